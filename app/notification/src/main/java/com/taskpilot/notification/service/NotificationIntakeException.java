/*
 * どこで: Notification サービス層
 * 何を: 受付内容そのものが不正で処理できないことを示す例外
 * なぜ: 再試行しても回復しない入力不備を、保存層の障害と区別して呼び出し元へ返すため
 */
package com.taskpilot.notification.service;

public class NotificationIntakeException extends RuntimeException {

    public NotificationIntakeException(String message) {
        super(message);
    }

    public NotificationIntakeException(String message, Throwable cause) {
        super(message, cause);
    }
}
