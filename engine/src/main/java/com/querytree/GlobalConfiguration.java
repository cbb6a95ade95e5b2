/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.querytree;

import com.querytree.exception.ErrorCode;
import com.querytree.exception.QueryTreeException;
import com.querytree.log.LogManager;
import com.querytree.utility.Callable;
import com.querytree.utility.SystemVariableResolver;
import org.json.JSONObject;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
 * Keeps all configuration settings. At startup assigns the configuration values by reading system properties and
 * environment variables.
 */
public enum GlobalConfiguration {
  // ENVIRONMENT
  DUMP_CONFIG_AT_STARTUP("querytree.dumpConfigAtStartup", "Dumps the configuration at startup", Boolean.class, false,
      new Callable<Object, Object>() {
        @Override
        public Object call(final Object value) {
          if (Boolean.parseBoolean(String.valueOf(value)))
            dumpConfiguration(System.out);
          return value;
        }
      }),

  // TRAVERSAL
  TRAVERSAL_INITIAL_STACK_SIZE("querytree.traversal.initialStackSize",
      "Initial capacity of the frame stack used by the rewriting traversal. The stack grows on demand with the depth of the tree",
      Integer.class, 32, new Callable<Object, Object>() {
    @Override
    public Object call(final Object value) {
      final int size = ((Number) value).intValue();
      if (size < 1) {
        if (LogManager.instance() != null)
          LogManager.instance()
              .log(this, Level.WARNING, "Setting '%s=%d' is not valid, using the minimum value of 1", "querytree.traversal.initialStackSize", size);
        return 1;
      }
      return value;
    }
  }),

  WALKER_STRICT_COMMANDS("querytree.walker.strictCommands",
      "Read-only walks reject rewrite commands (replace, delete) instead of ignoring them", Boolean.class, false),

  // NORMALIZATION
  NORMALIZE_STRIP_COMMENTS("querytree.normalize.stripComments",
      "Default for position normalization: also remove the comments attached to the nodes", Boolean.class, false),

  // RENDERING
  RENDERER_CLASS("querytree.renderer.class",
      "Full class name of the renderer to use when none has been registered programmatically. Empty means no renderer", String.class, ""),
  ;

  /**
   * Place holder for the "undefined" value of setting.
   */
  private final Object nullValue = new Object();

  private final       String                   key;
  private final       Object                   defValue;
  private final       Class<?>                 type;
  private final       Callable<Object, Object> callback;
  private volatile    Object                   value  = nullValue;
  private final       String                   description;
  public final static String                   PREFIX = "querytree.";

  static {
    readConfiguration();
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue) {
    this(key, description, type, defValue, null);
  }

  GlobalConfiguration(final String key, final String description, final Class<?> type, final Object defValue,
      final Callable<Object, Object> callback) {
    this.key = key;
    this.description = description;
    this.defValue = defValue;
    this.type = type;
    this.callback = callback;
  }

  /**
   * Reset all the configurations to the default values.
   */
  public static void resetAll() {
    for (GlobalConfiguration v : values())
      v.reset();
  }

  /**
   * Reset the configuration to the default value.
   */
  public void reset() {
    value = nullValue;
  }

  public static void dumpConfiguration(final PrintStream out) {
    out.println("QUERYTREE configuration:");

    String lastSection = "";
    for (GlobalConfiguration v : values()) {
      final String section = v.key.substring(PREFIX.length(), v.key.indexOf('.', PREFIX.length()) > -1 ?
          v.key.indexOf('.', PREFIX.length()) :
          v.key.length());

      if (!lastSection.equals(section)) {
        out.print("- ");
        out.println(section.toUpperCase(Locale.ENGLISH));
        lastSection = section;
      }
      out.print("  + ");
      out.print(v.key);
      out.print(" = ");
      out.println(String.valueOf((Object) v.getValue()));
    }
  }

  public static void fromJSON(final String input) {
    if (input == null)
      return;

    final JSONObject json = new JSONObject(input);
    final JSONObject cfg = json.getJSONObject("configuration");
    for (String k : cfg.keySet()) {
      final GlobalConfiguration cfgEntry = findByKey(PREFIX + k);
      if (cfgEntry != null)
        cfgEntry.setValue(cfg.get(k));
    }
  }

  public static String toJSON() {
    final JSONObject json = new JSONObject();

    final JSONObject cfg = new JSONObject();
    json.put("configuration", cfg);

    for (GlobalConfiguration k : values())
      cfg.put(k.key.substring(PREFIX.length()), (Object) k.getValue());

    return json.toString();
  }

  /**
   * Finds the setting by key, case insensitive.
   *
   * @return the setting if found, otherwise null
   */
  public static GlobalConfiguration findByKey(final String key) {
    for (GlobalConfiguration v : values()) {
      if (v.getKey().equalsIgnoreCase(key))
        return v;
    }
    return null;
  }

  /**
   * Changes the configuration values in one shot by passing a Map of values. Keys can be the Java ENUM names or the
   * string representation of configuration values
   */
  public static void setConfiguration(final Map<String, Object> config) {
    for (Map.Entry<String, Object> entry : config.entrySet()) {
      for (GlobalConfiguration v : values()) {
        if (v.getKey().equals(entry.getKey()) || v.name().equals(entry.getKey())) {
          v.setValue(entry.getValue());
          break;
        }
      }
    }
  }

  private static void readConfiguration() {
    for (GlobalConfiguration config : values()) {
      String prop = System.getProperty(config.key);
      if (prop == null)
        prop = System.getenv(config.key);

      if (prop != null)
        try {
          config.setValue(prop);
        } catch (final QueryTreeException e) {
          // KEEP THE DEFAULT VALUE
          if (LogManager.instance() != null)
            LogManager.instance()
                .log(GlobalConfiguration.class, Level.WARNING, "Invalid value '%s' for setting '%s', using the default %s", prop,
                    config.key, config.defValue);
        }
    }
  }

  public <T> T getValue() {
    //noinspection unchecked
    return (T) (value != nullValue && value != null ? value : defValue);
  }

  /**
   * @return {@literal true} if configuration was changed from default value and {@literal false} otherwise.
   */
  public boolean isChanged() {
    return value != nullValue;
  }

  /**
   * Assigns a new value, converting it to the type of the setting.
   *
   * @throws QueryTreeException with {@link ErrorCode#CONFIGURATION_ERROR} if the value cannot be converted
   */
  public void setValue(final Object newValue) {
    if (newValue != null)
      try {
        if (type == Boolean.class)
          value = Boolean.parseBoolean(newValue.toString());
        else if (type == Integer.class)
          value = newValue instanceof Number ? ((Number) newValue).intValue() : Integer.parseInt(newValue.toString().trim());
        else if (type == String.class)
          value = newValue.toString();
        else
          value = newValue;
      } catch (final NumberFormatException e) {
        throw new QueryTreeException(ErrorCode.CONFIGURATION_ERROR,
            "Invalid value '" + newValue + "' for setting '" + key + "' of type " + type.getSimpleName(), e,
            Map.<String, Object>of("key", key, "value", newValue.toString()));
      }

    if (callback != null)
      try {
        final Object callbackValue = callback.call(getValue());
        if (callbackValue != getValue())
          // OVERWRITE IT
          value = callbackValue;
      } catch (Exception e) {
        if (LogManager.instance() != null)
          LogManager.instance().log(this, Level.SEVERE, "Error during setting property %s=%s", e, key, value);
      }
  }

  public boolean getValueAsBoolean() {
    final Object v = getValue();
    return v instanceof Boolean ? (Boolean) v : Boolean.parseBoolean(v.toString());
  }

  public String getValueAsString() {
    final Object v = getValue();
    return v != null ? SystemVariableResolver.INSTANCE.resolveSystemVariables(v.toString(), "") : null;
  }

  public int getValueAsInteger() {
    final Object v = getValue();
    return v instanceof Number ? ((Number) v).intValue() : Integer.parseInt(v.toString());
  }

  public String getKey() {
    return key;
  }

  public Object getDefValue() {
    return defValue;
  }

  public Class<?> getType() {
    return type;
  }

  public String getDescription() {
    return description;
  }
}
