package com.ryvin.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: 現在のスレッドに紐づく trace id を返す。
   * 動作: MDC の trace_id, traceId の順に参照し、どちらも無ければ新規採番する。
   * 前提: なし。
   */
  public static String currentOrNew() {
    final String traceId = MDC.get("trace_id");
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get("traceId");
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
