package com.ryvin.matching.service;

import com.ryvin.common.event.JourneyEventPayload;

/** ステージ遷移を外部へ知らせる送信口。失敗は例外で返し、扱いは呼び出し側が決める。 */
public interface JourneyNotificationSender {

  void send(JourneyEventPayload payload);
}
