/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.tether;

import static com.github.mizosoft.tether.internal.Validate.requireArgument;
import static com.github.mizosoft.tether.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An object that represents the {@link Type} of the generic argument {@code T}. This class utilizes
 * the supertype-token idiom, which is used to capture complex types (i.e. generic collections) that
 * are otherwise impossible to represent using ordinary {@code Class} objects.
 *
 * @param <T> the type this object represents
 */
public abstract class TypeRef<T> {
  private final Type type;
  private final Class<? super T> rawType;

  /**
   * Creates a new {@code TypeRef<T>} capturing the {@code Type} of {@code T}. It is usually the
   * case that this constructor is invoked as an anonymous class expression (e.g. {@code new
   * TypeRef<List<String>>() {}}).
   *
   * @throws IllegalStateException if the raw version of this class is used
   */
  @SuppressWarnings("unchecked")
  protected TypeRef() {
    Type superClass = getClass().getGenericSuperclass();
    requireState(superClass instanceof ParameterizedType, "not used in parameterized form");
    this.type = ((ParameterizedType) superClass).getActualTypeArguments()[0];
    this.rawType = (Class<? super T>) findRawType(type);
  }

  @SuppressWarnings("unchecked")
  private TypeRef(Type type) {
    this.type = requireNonNull(type);
    this.rawType = (Class<? super T>) findRawType(type);
  }

  /** Returns the underlying java {@link Type}. */
  public final Type type() {
    return type;
  }

  /** Returns the {@code Class} object that represents the raw type of {@code T}. */
  public final Class<? super T> rawType() {
    return rawType;
  }

  /** Casts the given object, which must be an instance of this type's raw type, into {@code T}. */
  @SuppressWarnings("unchecked")
  public final @Nullable T uncheckedCast(@Nullable Object value) {
    return (T) value;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof TypeRef)) {
      return false;
    }
    return type.equals(((TypeRef<?>) obj).type);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode();
  }

  @Override
  public String toString() {
    return type.getTypeName();
  }

  private static Class<?> findRawType(Type type) {
    if (type instanceof Class) {
      return (Class<?>) type;
    }
    if (type instanceof ParameterizedType) {
      Type rawType = ((ParameterizedType) type).getRawType();
      requireArgument(
          rawType instanceof Class,
          "ParameterizedType::getRawType of %s returned a non-raw type: %s",
          type,
          rawType);
      return (Class<?>) rawType;
    }
    if (type instanceof GenericArrayType) {
      // Here, the raw type is the type of the array created with the generic-component's raw type
      Class<?> rawComponentType = findRawType(((GenericArrayType) type).getGenericComponentType());
      return Array.newInstance(rawComponentType, 0).getClass();
    }
    if (type instanceof TypeVariable) {
      return rawUpperBound(((TypeVariable<?>) type).getBounds());
    }
    if (type instanceof WildcardType) {
      return rawUpperBound(((WildcardType) type).getUpperBounds());
    }
    throw new IllegalArgumentException("unsupported specialization of Type: " + type);
  }

  private static Class<?> rawUpperBound(Type[] upperBounds) {
    // Same behaviour as Method::getGenericReturnType vs Method::getReturnType
    return upperBounds.length > 0 ? findRawType(upperBounds[0]) : Object.class;
  }

  /** Creates a new {@code TypeRef} from the given class. */
  public static <U> TypeRef<U> of(Class<U> rawType) {
    return new ExplicitTypeRef<>(rawType);
  }

  /**
   * Creates a new {@code TypeRef} from the given type.
   *
   * @throws IllegalArgumentException if the given type is not a standard specialization of a java
   *     {@code Type}
   */
  public static TypeRef<?> of(Type type) {
    return new ExplicitTypeRef<>(type);
  }

  private static final class ExplicitTypeRef<T> extends TypeRef<T> {
    ExplicitTypeRef(Type type) {
      super(type);
    }
  }
}
