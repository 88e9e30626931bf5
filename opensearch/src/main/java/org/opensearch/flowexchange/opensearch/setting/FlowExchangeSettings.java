/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.setting;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.common.settings.ClusterSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;

/**
 * Node settings of the flow exchange. The static {@link Setting} constants are registered by the
 * plugin; an instance holds their current values and follows dynamic updates once {@link
 * #registerListeners(ClusterSettings)} has been called.
 */
@Log4j2
public class FlowExchangeSettings {

  public static final Setting<Integer> STREAM_BUFFER_SIZE =
      Setting.intSetting(
          "plugins.flow_exchange.stream.buffer_size",
          1024,
          1,
          Setting.Property.NodeScope,
          Setting.Property.Dynamic);

  public static final Setting<Integer> OUTBOX_BATCH_SIZE =
      Setting.intSetting(
          "plugins.flow_exchange.outbox.batch_size",
          100,
          1,
          Setting.Property.NodeScope,
          Setting.Property.Dynamic);

  public static final Setting<TimeValue> OUTBOX_FLUSH_INTERVAL =
      Setting.timeSetting(
          "plugins.flow_exchange.outbox.flush_interval",
          TimeValue.timeValueMillis(100),
          Setting.Property.NodeScope,
          Setting.Property.Dynamic);

  public static final Setting<TimeValue> STREAM_CONNECTION_TIMEOUT =
      Setting.timeSetting(
          "plugins.flow_exchange.stream.connection_timeout",
          TimeValue.timeValueSeconds(10),
          Setting.Property.NodeScope,
          Setting.Property.Dynamic);

  public static final Setting<Boolean> ROW_COUNT_TRACKING =
      Setting.boolSetting(
          "plugins.flow_exchange.outbox.row_count_tracking",
          false,
          Setting.Property.NodeScope,
          Setting.Property.Dynamic);

  private volatile int streamBufferSize;
  private volatile int outboxBatchSize;
  private volatile TimeValue outboxFlushInterval;
  private volatile TimeValue streamConnectionTimeout;
  private volatile boolean rowCountTracking;

  public FlowExchangeSettings(Settings settings) {
    this.streamBufferSize = STREAM_BUFFER_SIZE.get(settings);
    this.outboxBatchSize = OUTBOX_BATCH_SIZE.get(settings);
    this.outboxFlushInterval = OUTBOX_FLUSH_INTERVAL.get(settings);
    this.streamConnectionTimeout = STREAM_CONNECTION_TIMEOUT.get(settings);
    this.rowCountTracking = ROW_COUNT_TRACKING.get(settings);
  }

  /** Returns every setting of the flow exchange, for registration with the node. */
  public static List<Setting<?>> getSettings() {
    return List.of(
        STREAM_BUFFER_SIZE,
        OUTBOX_BATCH_SIZE,
        OUTBOX_FLUSH_INTERVAL,
        STREAM_CONNECTION_TIMEOUT,
        ROW_COUNT_TRACKING);
  }

  /** Follows dynamic updates of the settings. Flows already set up keep the values they read. */
  public void registerListeners(ClusterSettings clusterSettings) {
    clusterSettings.addSettingsUpdateConsumer(
        STREAM_BUFFER_SIZE, value -> streamBufferSize = value);
    clusterSettings.addSettingsUpdateConsumer(OUTBOX_BATCH_SIZE, value -> outboxBatchSize = value);
    clusterSettings.addSettingsUpdateConsumer(
        OUTBOX_FLUSH_INTERVAL, value -> outboxFlushInterval = value);
    clusterSettings.addSettingsUpdateConsumer(
        STREAM_CONNECTION_TIMEOUT, value -> streamConnectionTimeout = value);
    clusterSettings.addSettingsUpdateConsumer(
        ROW_COUNT_TRACKING,
        value -> {
          log.info("Row-count tracking {}", value ? "enabled" : "disabled");
          rowCountTracking = value;
        });
  }

  public int getStreamBufferSize() {
    return streamBufferSize;
  }

  public int getOutboxBatchSize() {
    return outboxBatchSize;
  }

  public TimeValue getOutboxFlushInterval() {
    return outboxFlushInterval;
  }

  public TimeValue getStreamConnectionTimeout() {
    return streamConnectionTimeout;
  }

  public boolean isRowCountTracking() {
    return rowCountTracking;
  }
}
