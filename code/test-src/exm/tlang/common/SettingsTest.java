/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.tlang.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tlang.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Before
  public void init() throws Exception {
    Settings.initTLangProperties();
  }

  @After
  public void restore() throws Exception {
    System.clearProperty(Settings.TIMEOUT_MS);
    Settings.initTLangProperties();
  }

  @Test
  public void testDefaults() throws Exception {
    assertEquals(1000, Settings.getInt(Settings.MAX_CALL_DEPTH));
    assertEquals(1048576L, Settings.getLong(Settings.MAX_OUTPUT_BYTES));
    assertEquals(10000L, Settings.getLong(Settings.TIMEOUT_MS));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    Settings.validateProperties();
  }

  @Test
  public void testKeysSorted() {
    List<String> keys = Settings.getKeys();
    assertTrue(keys.contains(Settings.THREAD_STACK_SIZE));
    assertTrue(keys.indexOf(Settings.LOG_FILE) <
               keys.indexOf(Settings.MAX_CALL_DEPTH));
  }

  @Test
  public void testSystemPropertyOverride() throws Exception {
    System.setProperty(Settings.TIMEOUT_MS, "250");
    Settings.initTLangProperties();
    assertEquals(250L, Settings.getLong(Settings.TIMEOUT_MS));
  }

  @Test
  public void testNonNumeric() throws Exception {
    Settings.set(Settings.MAX_CALL_DEPTH, "deep");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("Invalid integral value for option "
                            + "tlang.max-call-depth: deep");
    Settings.getInt(Settings.MAX_CALL_DEPTH);
  }

  @Test
  public void testMustBePositive() throws Exception {
    Settings.set(Settings.MAX_CALL_DEPTH, "0");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("to be positive");
    Settings.validateProperties();
  }

  @Test
  public void testBadBoolean() throws Exception {
    Settings.set(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.LOG_TRACE);
  }

  @Test
  public void testInitDiscardsEarlierValues() throws Exception {
    Settings.set(Settings.MAX_CALL_DEPTH, "10");
    Settings.set(Settings.LOG_FILE, "old.log");
    Settings.initTLangProperties();
    assertEquals(1000, Settings.getInt(Settings.MAX_CALL_DEPTH));
    assertEquals("", Settings.get(Settings.LOG_FILE));
  }
}
