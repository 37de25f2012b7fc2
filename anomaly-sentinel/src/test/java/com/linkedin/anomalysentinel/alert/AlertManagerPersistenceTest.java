/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.anomalysentinel.alert;

import com.linkedin.anomalysentinel.alert.store.AlertStore;
import com.linkedin.anomalysentinel.config.AlertManagerConfig;
import com.linkedin.anomalysentinel.detector.ExpectedRange;
import com.linkedin.anomalysentinel.detector.Severity;
import com.linkedin.anomalysentinel.detector.statistical.StatisticalDetectors;
import com.linkedin.anomalysentinel.detector.statistical.ZScoreAnomaly;
import com.linkedin.anomalysentinel.exception.AlertNotFoundException;
import com.linkedin.anomalysentinel.exception.PersistenceException;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import org.easymock.Capture;
import org.easymock.EasyMock;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;


/**
 * Checks how {@link AlertManager} drives its {@link AlertStore} and surfaces store failures.
 */
public class AlertManagerPersistenceTest {
  private static final long NOW_MS = 1_700_000_000_000L;
  private static final PersistenceException STORE_DOWN = new PersistenceException("Connection refused");

  private static ZScoreAnomaly anomaly() {
    return StatisticalDetectors.detectZScore(new double[]{10, 10, 10, 10, 100}, 1.5).anomalies().get(0);
  }

  private static AlertManager alertManager(AlertStore store) {
    return new AlertManager(store, AlertManagerConfig.defaults(), new MockClock(NOW_MS));
  }

  @Test
  public void testCreateAlertInsertsOpenAlert() throws Exception {
    AlertStore mockStore = EasyMock.mock(AlertStore.class);
    Capture<Alert> inserted = Capture.newInstance();
    Alert stored = Alert.open("cpu", "z-score", Severity.WARNING, 100.0, null, NOW_MS).withId(7L);
    EasyMock.expect(mockStore.insert(EasyMock.capture(inserted))).andReturn(stored);
    EasyMock.replay(mockStore);

    assertSame(stored, alertManager(mockStore).createAlert("cpu", anomaly(), "z-score"));
    Alert alert = inserted.getValue();
    assertEquals(Alert.UNASSIGNED_ID, alert.id());
    assertEquals(NOW_MS, alert.detectedAtMs());
    assertEquals(Severity.WARNING, alert.severity());
    assertFalse(alert.isAcknowledged());
    EasyMock.verify(mockStore);
  }

  @Test
  public void testCreateAlertPropagatesStoreFailure() throws Exception {
    AlertStore mockStore = EasyMock.mock(AlertStore.class);
    EasyMock.expect(mockStore.insert(EasyMock.anyObject(Alert.class))).andThrow(STORE_DOWN);
    EasyMock.replay(mockStore);

    PersistenceException pe = assertThrows(PersistenceException.class,
                                           () -> alertManager(mockStore).createAlert("cpu", anomaly(), "z-score"));
    assertSame(STORE_DOWN, pe);
    EasyMock.verify(mockStore);
  }

  @Test
  public void testGetActiveAlertsUsesConfiguredLimit() throws Exception {
    AlertStore mockStore = EasyMock.mock(AlertStore.class);
    EasyMock.expect(mockStore.findUnacknowledged(Severity.CRITICAL, AlertManagerConfig.DEFAULT_ALERT_ACTIVE_MAX_RESULTS))
            .andReturn(Collections.emptyList());
    EasyMock.expect(mockStore.findUnacknowledged(null, AlertManagerConfig.DEFAULT_ALERT_ACTIVE_MAX_RESULTS))
            .andThrow(STORE_DOWN);
    EasyMock.replay(mockStore);

    AlertManager alertManager = alertManager(mockStore);
    assertEquals(Collections.emptyList(), alertManager.getActiveAlerts(Severity.CRITICAL));
    assertThrows(PersistenceException.class, alertManager::getActiveAlerts);
    EasyMock.verify(mockStore);
  }

  @Test
  public void testAcknowledgeAlert() throws Exception {
    AlertStore mockStore = EasyMock.mock(AlertStore.class);
    Alert acknowledged = Alert.open("cpu", "z-score", Severity.WARNING, 100.0, new ExpectedRange(9.0, 11.0), NOW_MS - 10L)
                              .withId(3L)
                              .acknowledge(NOW_MS, "noisy neighbor");
    EasyMock.expect(mockStore.acknowledge(3L, NOW_MS, "noisy neighbor")).andReturn(acknowledged);
    EasyMock.expect(mockStore.acknowledge(4L, NOW_MS, null)).andReturn(null);
    EasyMock.expect(mockStore.acknowledge(5L, NOW_MS, null)).andThrow(STORE_DOWN);
    EasyMock.replay(mockStore);

    AlertManager alertManager = alertManager(mockStore);
    assertSame(acknowledged, alertManager.acknowledgeAlert(3L, "noisy neighbor"));
    assertThrows(AlertNotFoundException.class, () -> alertManager.acknowledgeAlert(4L));
    assertThrows(PersistenceException.class, () -> alertManager.acknowledgeAlert(5L));
    EasyMock.verify(mockStore);
  }

  @Test
  public void testAnomalyStatsWindow() throws Exception {
    AlertStore mockStore = EasyMock.mock(AlertStore.class);
    EasyMock.expect(mockStore.aggregate(NOW_MS - TimeUnit.HOURS.toMillis(24))).andReturn(Collections.emptyList());
    EasyMock.expect(mockStore.aggregate(NOW_MS - TimeUnit.HOURS.toMillis(6))).andThrow(STORE_DOWN);
    EasyMock.replay(mockStore);

    AlertManager alertManager = alertManager(mockStore);
    assertEquals(Collections.emptyList(), alertManager.getAnomalyStats());
    assertThrows(PersistenceException.class, () -> alertManager.getAnomalyStats(6));
    EasyMock.verify(mockStore);
  }
}
