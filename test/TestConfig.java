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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestConfig {

  @Rule
  public final TemporaryFolder folder = new TemporaryFolder();

  /** Writes the given properties to a new file and returns its path.  */
  private String writeProperties(final Properties props) throws IOException {
    final File file = folder.newFile("tablet.conf");
    final FileOutputStream out = new FileOutputStream(file);
    try {
      props.store(out, null);
    } finally {
      out.close();
    }
    return file.getPath();
  }

  @Test
  public void defaultCtor() throws Exception {
    final Config config = new Config();
    assertNotNull(config);
    assertNull(config.config_location);
    assertEquals(60000, config.getLong("tablet.cache.staleness_ms"));
    assertEquals("CLOSEST_REPLICA",
                 config.getString("tablet.client.replica_selection"));
  }

  @Test
  public void constructorChild() throws Exception {
    final Config config = new Config();
    final Config child = new Config(config);
    assertNotNull(child);
    assertNull(child.config_location);
    assertTrue(config.getMap() != child.getMap());
  }

  @Test
  public void constructorChildCopy() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.client.zone", "us-east-1a");
    final Config child = new Config(config);
    child.overrideConfig("tablet.lookup.timeout_ms", "500");
    assertEquals("us-east-1a", child.getString("tablet.client.zone"));
    assertEquals(10000, config.getLong("tablet.lookup.timeout_ms"));
    assertEquals(500, child.getLong("tablet.lookup.timeout_ms"));
  }

  @Test(expected = NullPointerException.class)
  public void constructorNullChild() throws Exception {
    new Config((Config) null);
  }

  @Test
  public void constructorWithFile() throws Exception {
    final Properties props = new Properties();
    props.setProperty("tablet.client.region", "eu-west-1");
    props.setProperty("tablet.lookup.backoff_base_ms", "50");
    final String path = writeProperties(props);

    final Config config = new Config(path);
    assertEquals(path, config.config_location);
    assertEquals("eu-west-1", config.getString("tablet.client.region"));
    assertEquals(50, config.getInt("tablet.lookup.backoff_base_ms"));
    // Defaults are kept for what the file doesn't say.
    assertEquals(5000, config.getInt("tablet.lookup.backoff_max_ms"));
  }

  @Test(expected = FileNotFoundException.class)
  public void constructorFileNotFound() throws Exception {
    new Config(new File(folder.getRoot(), "nope.conf").getPath());
  }

  @Test(expected = NullPointerException.class)
  public void constructorNullFile() throws Exception {
    new Config((String) null);
  }

  @Test(expected = FileNotFoundException.class)
  public void constructorEmptyFile() throws Exception {
    new Config("");
  }

  @Test(expected = FileNotFoundException.class)
  public void loadConfigNotFound() throws Exception {
    final Config config = new Config();
    config.loadConfig(new File(folder.getRoot(), "nope.conf").getPath());
  }

  @Test(expected = NullPointerException.class)
  public void loadConfigNull() throws Exception {
    final Config config = new Config();
    config.loadConfig(null);
  }

  @Test
  public void overrideConfig() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.client.cloud", "gcp");
    assertEquals("gcp", config.getString("tablet.client.cloud"));
  }

  @Test
  public void getStringNull() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.null", null);
    assertNull(config.getString("tablet.null"));
  }

  @Test
  public void getStringDoesNotExist() throws Exception {
    final Config config = new Config();
    assertNull(config.getString("tablet.nosuchkey"));
  }

  @Test
  public void getInt() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.int", Integer.toString(Integer.MIN_VALUE));
    assertEquals(Integer.MIN_VALUE, config.getInt("tablet.int"));
  }

  @Test(expected = NumberFormatException.class)
  public void getIntDoesNotExist() throws Exception {
    final Config config = new Config();
    config.getInt("tablet.nosuchkey");
  }

  @Test(expected = NumberFormatException.class)
  public void getIntNFE() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.int", "this can't be parsed to int");
    config.getInt("tablet.int");
  }

  @Test
  public void getLong() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.long", Long.toString(Long.MAX_VALUE));
    assertEquals(Long.MAX_VALUE, config.getLong("tablet.long"));
  }

  @Test(expected = NumberFormatException.class)
  public void getLongNull() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.null", null);
    config.getLong("tablet.null");
  }

  @Test
  public void getBoolean() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.bool", "1");
    assertTrue(config.getBoolean("tablet.bool"));
    config.overrideConfig("tablet.bool", "yes");
    assertTrue(config.getBoolean("tablet.bool"));
    config.overrideConfig("tablet.bool", "True");
    assertTrue(config.getBoolean("tablet.bool"));
    config.overrideConfig("tablet.bool", "0");
    assertFalse(config.getBoolean("tablet.bool"));
    config.overrideConfig("tablet.bool", "");
    assertFalse(config.getBoolean("tablet.bool"));
    assertFalse(config.getBoolean("tablet.nosuchkey"));
  }

  @Test
  public void hasProperty() throws Exception {
    final Config config = new Config();
    assertTrue(config.hasProperty("tablet.lookup.timeout_ms"));
    // Present, but empty.
    assertFalse(config.hasProperty("tablet.client.zone"));
    assertFalse(config.hasProperty("tablet.nosuchkey"));
  }

  @Test
  public void dumpConfiguration() throws Exception {
    final Config config = new Config();
    config.overrideConfig("tablet.client.zone", "us-east-1a");
    final String dump = config.dumpConfiguration();
    assertTrue(dump.startsWith("Configuration:\n"));
    assertTrue(dump.contains("Key [tablet.client.zone]  Value [us-east-1a]"));
  }

}
