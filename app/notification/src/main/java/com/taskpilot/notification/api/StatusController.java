/*
 * どこで: Notification API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: actuator を開かない環境でも疎通だけ確認できるようにするため
 */
package com.taskpilot.notification.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "notification-router: ok";
  }
}
