/*
 * Copyright (C) 2026  The Async Tablet Authors.  All rights reserved.
 * This file is part of Async Tablet.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   - Redistributions of source code must retain the above copyright notice,
 *     this list of conditions and the following disclaimer.
 *   - Redistributions in binary form must reproduce the above copyright notice,
 *     this list of conditions and the following disclaimer in the documentation
 *     and/or other materials provided with the distribution.
 *   - Neither the name of the StumbleUpon nor the names of its contributors
 *     may be used to endorse or promote products derived from this software
 *     without specific prior written permission.
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED.  IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.tablet.async;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * String key/value settings of a {@link TabletLocator}, with helpers to parse
 * them as numbers or booleans.
 * <p>
 * Every key the locator reads has a default, set by {@link #loadDefaults}
 * before a properties file or any override is applied.  The keys are:
 * <ul>
 *   <li>{@code tablet.cache.staleness_ms}: how long a cached tablet is
 *   trusted without asking the metadata authority again.</li>
 *   <li>{@code tablet.directory.eviction_grace_ms} and
 *   {@code tablet.directory.eviction_interval_ms}: how long a server no
 *   tablet refers to stays in the directory, and how often we check.</li>
 *   <li>{@code tablet.lookup.*}: timeout, backoff and throttling of
 *   metadata lookups.</li>
 *   <li>{@code tablet.timer.*}: tuning of the timer wheel.</li>
 *   <li>{@code tablet.client.*}: where this client lives, and the default
 *   replica selection.</li>
 * </ul>
 * Reading from several threads is fine, changing values isn't: configure
 * the object before handing it to the locator.
 */
public class Config {
  private static final Logger LOG = LoggerFactory.getLogger(Config.class);

  /** Current values, defaults included.  Not synchronized on purpose.  */
  protected final HashMap<String, String> properties =
    new HashMap<String, String>();

  /** Default value of every setting we know about.  */
  protected final HashMap<String, String> default_map =
    new HashMap<String, String>();

  /** Path of the properties file we loaded, if any.  */
  protected String config_location;

  /** Creates a configuration holding only the defaults.  */
  public Config() {
    loadDefaults();
  }

  /**
   * Creates a configuration from the defaults, overridden by the given
   * properties file.
   * @param file Path to a Java properties file.
   * @throws FileNotFoundException if there's no such file.
   * @throws IOException if the file couldn't be read or parsed.
   */
  public Config(final String file) throws IOException {
    loadDefaults();
    loadConfig(file);
  }

  /**
   * Creates a copy of another configuration.
   * Changes made to the copy don't affect the parent, and vice versa.
   * The file isn't read again, but its path is remembered.
   * @param parent The configuration to copy.
   */
  public Config(final Config parent) {
    properties.putAll(parent.properties);
    config_location = parent.config_location;
    loadDefaults();
  }

  /**
   * Sets a property, replacing whatever value it had.
   * Not thread-safe, only call this while setting things up.
   * @param property The name of the property.
   * @param value Its new value.
   */
  public void overrideConfig(final String property, final String value) {
    properties.put(property, value);
  }

  /**
   * Returns the raw value of a property.
   * @return The value, or {@code null} if it's not set.
   */
  public final String getString(final String property) {
    return properties.get(property);
  }

  /**
   * Returns a property parsed as an {@code int}.
   * @throws NumberFormatException if the property isn't set or isn't an
   * integer.
   */
  public final int getInt(final String property) {
    return Integer.parseInt(properties.get(property));
  }

  /**
   * Returns a property parsed as a {@code long}.
   * @throws NumberFormatException if the property isn't set or isn't an
   * integer.
   */
  public final long getLong(final String property) {
    return Long.parseLong(properties.get(property));
  }

  /**
   * Returns a property parsed as a boolean.
   * {@code 1}, {@code true} and {@code yes}, in any case, mean true.
   * Anything else, or a missing property, means false.
   */
  public final boolean getBoolean(final String property) {
    final String val = properties.get(property);
    if (val == null) {
      return false;
    }
    return "1".equals(val)
      || "true".equalsIgnoreCase(val)
      || "yes".equalsIgnoreCase(val);
  }

  /**
   * Returns {@code true} if the property is set to a non-empty value.
   */
  public final boolean hasProperty(final String property) {
    final String val = properties.get(property);
    return val != null && !val.isEmpty();
  }

  /**
   * Returns every setting, one per line, for debugging.
   */
  public final String dumpConfiguration() {
    if (properties.isEmpty()) {
      return "No configuration settings stored";
    }
    final StringBuilder buf = new StringBuilder("Configuration:\n");
    buf.append("File [").append(config_location).append("]");
    for (final Map.Entry<String, String> entry : properties.entrySet()) {
      buf.append("\nKey [").append(entry.getKey())
        .append("]  Value [").append(entry.getValue()).append(']');
    }
    return buf.toString();
  }

  /** Returns a copy of all the settings.  */
  public final Map<String, String> getMap() {
    return new HashMap<String, String>(properties);
  }

  /**
   * Fills in the default of every setting that has no value yet.
   */
  private void loadDefaults() {
    /* --------- Location cache --------- */
    default_map.put("tablet.cache.staleness_ms", "60000");
    default_map.put("tablet.directory.eviction_grace_ms", "300000");
    // 0 disables the background sweep.
    default_map.put("tablet.directory.eviction_interval_ms", "60000");

    /* --------- Metadata lookups --------- */
    default_map.put("tablet.lookup.timeout_ms", "10000");
    default_map.put("tablet.lookup.waiters_high_watermark", "10000");
    default_map.put("tablet.lookup.backoff_base_ms", "200");
    default_map.put("tablet.lookup.backoff_max_ms", "5000");

    /* --------- Timer --------- */
    default_map.put("tablet.timer.tick", "20");
    default_map.put("tablet.timer.ticks_per_wheel", "512");

    /* --------- Where this client lives --------- */
    default_map.put("tablet.client.uuid", "");
    default_map.put("tablet.client.cloud", "");
    default_map.put("tablet.client.region", "");
    default_map.put("tablet.client.zone", "");
    default_map.put("tablet.client.replica_selection", "CLOSEST_REPLICA");

    for (final Map.Entry<String, String> entry : default_map.entrySet()) {
      if (!properties.containsKey(entry.getKey())) {
        properties.put(entry.getKey(), entry.getValue());
      }
    }
  }

  /**
   * Loads a properties file on top of the current settings.
   * @param file Path to the file.
   * @throws FileNotFoundException if there's no such file.
   * @throws IOException if the file couldn't be read or parsed.
   */
  protected void loadConfig(final String file) throws IOException {
    final FileInputStream stream = new FileInputStream(file);
    try {
      final Properties props = new Properties();
      props.load(stream);
      for (final String key : props.stringPropertyNames()) {
        properties.put(key, props.getProperty(key));
      }
      LOG.info("Loaded configuration file: " + file);
      config_location = file;
    } finally {
      stream.close();
    }
  }
}
