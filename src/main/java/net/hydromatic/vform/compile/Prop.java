/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.vform.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Properties that control how a {@link Pipeline} processes a form. */
public enum Prop {
  /**
   * Boolean property "simplify" controls whether to simplify each integrand
   * after its derivatives have been resolved. Default is true.
   */
  SIMPLIFY("simplify", Boolean.class, true),

  /**
   * Boolean property "lowerCompounds" controls whether to rewrite compound
   * tensor operators (inner, dot, determinant, inverse and so forth) into
   * index notation. Default is false.
   */
  LOWER_COMPOUNDS("lowerCompounds", Boolean.class, false),

  /**
   * Boolean property "expandIndices" controls whether to expand index
   * notation into explicit components. Implies "lowerCompounds". Default is
   * false.
   */
  EXPAND_INDICES("expandIndices", Boolean.class, false),

  /**
   * Boolean property "checkArity" controls whether to check that each
   * integrand is linear in each of the arguments of the form. Default is
   * true.
   */
  CHECK_ARITY("checkArity", Boolean.class, true),

  /**
   * Integer property "parallelism" is the number of threads used to process
   * the integrals of a form. Default is 1, which processes integrals in the
   * calling thread.
   */
  PARALLELISM("parallelism", Integer.class, 1),

  /**
   * Boolean property "signatureRenumbering" controls whether form signatures
   * renumber coefficients and domains in order, so that forms that differ
   * only in which coefficients they use have the same signature. Default is
   * true.
   */
  SIGNATURE_RENUMBERING("signatureRenumbering", Boolean.class, true),

  /**
   * Property "duplicates" controls what happens to sub-expressions that occur
   * more than once in an integrand. Default is "keep".
   */
  DUPLICATES("duplicates", DuplicateMode.class, DuplicateMode.KEEP);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType, "invalid type %s for property %s",
        type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of a property, allowing strings for enum types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent((Class<Enum>) type,
              ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: "
            + values);
      }
      set(map, optional.get());
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value restores the default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #DUPLICATES} property. */
  public enum DuplicateMode {
    /** Leave repeated sub-expressions as they are. The default. */
    KEEP,
    /** Wrap each repeated sub-expression in a variable. */
    MARK,
    /** Remove every variable, leaving its expression. */
    STRIP
  }
}

// End Prop.java
