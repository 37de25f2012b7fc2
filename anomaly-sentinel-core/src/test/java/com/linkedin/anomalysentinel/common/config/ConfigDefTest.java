/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.anomalysentinel.common.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;


public class ConfigDefTest {
  private static final String WINDOW = "window";
  private static final String RATIO = "ratio";
  private static final String METHODS = "methods";
  private static final String OPTIONAL = "optional";

  private static ConfigDef configDef() {
    return new ConfigDef()
        .define(WINDOW, ConfigDef.Type.INT, 5, ConfigDef.Range.atLeast(1), ConfigDef.Importance.HIGH, "window")
        .define(RATIO, ConfigDef.Type.DOUBLE, 0.5, ConfigDef.Range.between(0.0, 1.0), ConfigDef.Importance.MEDIUM, "ratio")
        .define(METHODS, ConfigDef.Type.LIST, "a,b", ConfigDef.ValidList.in("a", "b", "c"), ConfigDef.Importance.HIGH,
                "methods")
        .define(OPTIONAL, ConfigDef.Type.DOUBLE, null, ConfigDef.NullOr.of(ConfigDef.Range.atLeast(0.0)),
                ConfigDef.Importance.LOW, "optional");
  }

  @Test
  public void testDefaults() {
    Map<String, Object> values = configDef().parse(Collections.emptyMap());
    assertEquals(5, values.get(WINDOW));
    assertEquals(0.5, values.get(RATIO));
    assertEquals(Arrays.asList("a", "b"), values.get(METHODS));
    assertNull(values.get(OPTIONAL));
  }

  @Test
  public void testParseStrings() {
    Map<String, Object> props = new HashMap<>();
    props.put(WINDOW, " 7 ");
    props.put(RATIO, "0.25");
    props.put(METHODS, "c , A");
    props.put(OPTIONAL, "3");
    props.put("undefined", "ignored");

    Map<String, Object> values = configDef().parse(props);
    assertEquals(7, values.get(WINDOW));
    assertEquals(0.25, values.get(RATIO));
    assertEquals(Arrays.asList("c", "A"), values.get(METHODS));
    assertEquals(3.0, values.get(OPTIONAL));
    assertFalse(values.containsKey("undefined"));
  }

  @Test
  public void testIntegralNumbersParseAsInt() {
    assertEquals(3, configDef().parse(Map.of(WINDOW, 3.0)).get(WINDOW));
    assertEquals(12, configDef().parse(Map.of(WINDOW, 12L)).get(WINDOW));
    assertEquals(2, configDef().parse(Map.of(WINDOW, (short) 2)).get(WINDOW));
  }

  @Test
  public void testListOfStrings() {
    Map<String, Object> values = configDef().parse(Map.of(METHODS, List.of(" b", "c ")));
    assertEquals(Arrays.asList("b", "c"), values.get(METHODS));
    assertEquals(Collections.emptyList(), configDef().parse(Map.of(METHODS, "")).get(METHODS));
  }

  @Test
  public void testInvalidValues() {
    ConfigDef configDef = configDef();
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(WINDOW, 0)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(WINDOW, "five")));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(WINDOW, 2.5)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(WINDOW, 1E12)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(WINDOW, Double.NaN)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(WINDOW, true)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(RATIO, 1.5)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(RATIO, "NaN")));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(METHODS, "a,d")));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(METHODS, List.of(1, 2))));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(METHODS, 7)));
    assertThrows(ConfigException.class, () -> configDef.parse(Map.of(OPTIONAL, -1)));
  }

  @Test
  public void testNullValue() {
    Map<String, Object> props = new HashMap<>();
    props.put(OPTIONAL, null);
    assertNull(configDef().parse(props).get(OPTIONAL));
    props.put(WINDOW, null);
    assertThrows(ConfigException.class, () -> configDef().parse(props));
  }

  @Test
  public void testDefineTwice() {
    ConfigDef configDef = new ConfigDef().define(WINDOW, ConfigDef.Type.INT, 1, null, ConfigDef.Importance.HIGH, "window");
    assertThrows(ConfigException.class,
                 () -> configDef.define(WINDOW, ConfigDef.Type.INT, 2, null, ConfigDef.Importance.HIGH, "window"));
  }

  @Test
  public void testInvalidDefault() {
    assertThrows(ConfigException.class,
                 () -> new ConfigDef().define(WINDOW, ConfigDef.Type.INT, 0, ConfigDef.Range.atLeast(1),
                                              ConfigDef.Importance.HIGH, "window"));
  }

  @Test
  public void testValidatorDescriptions() {
    assertEquals("[1,...]", ConfigDef.Range.atLeast(1).toString());
    assertEquals("[0.0,1.0]", ConfigDef.Range.between(0.0, 1.0).toString());
    assertEquals("null or [0.0,...]", ConfigDef.NullOr.of(ConfigDef.Range.atLeast(0.0)).toString());
    assertEquals("[a, b]", ConfigDef.ValidList.in("a", "b").toString());
  }
}
