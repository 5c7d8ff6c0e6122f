/*
 * どこで: Notification 送信層のユニットテスト
 * 何を: CI/Test 専用失敗注入 Adapter の分岐を検証する
 * なぜ: 送信失敗時に保留が続くことを確かめるシナリオの前提が壊れないようにするため
 */
package com.taskpilot.notification.channel;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.taskpilot.notification.model.NotificationChannel;
import java.lang.reflect.Field;
import org.junit.jupiter.api.Test;

class FailureInjectingChannelAdapterTest {

  private static final String MARKER = "[fail-channel]";

  @Test
  void sendThrowsWhenMarkerIsContained() {
    final LocalChannelAdapter delegate = mock(LocalChannelAdapter.class);
    final FailureInjectingChannelAdapter adapter = adapter(delegate, MARKER, "");

    assertThatThrownBy(
            () -> adapter.send(NotificationChannel.PRIMARY_CHAT, "=== Daily Update ===\n  - " + MARKER))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failure injection");
    verify(delegate, never()).send(NotificationChannel.PRIMARY_CHAT, "=== Daily Update ===\n  - " + MARKER);
  }

  @Test
  void sendDelegatesWhenMarkerIsAbsent() {
    final LocalChannelAdapter delegate = mock(LocalChannelAdapter.class);
    final FailureInjectingChannelAdapter adapter = adapter(delegate, MARKER, "");

    assertThatCode(() -> adapter.send(NotificationChannel.PRIMARY_CHAT, "normal"))
        .doesNotThrowAnyException();

    verify(delegate).send(NotificationChannel.PRIMARY_CHAT, "normal");
  }

  @Test
  void sendFailsOnlyConfiguredChannel() {
    final LocalChannelAdapter delegate = mock(LocalChannelAdapter.class);
    final FailureInjectingChannelAdapter adapter = adapter(delegate, MARKER, "SHORT_MESSAGE");
    final String text = "deadline " + MARKER;

    assertThatThrownBy(() -> adapter.send(NotificationChannel.SHORT_MESSAGE, text))
        .isInstanceOf(IllegalStateException.class);
    assertThatCode(() -> adapter.send(NotificationChannel.PRIMARY_CHAT, text))
        .doesNotThrowAnyException();

    verify(delegate).send(NotificationChannel.PRIMARY_CHAT, text);
  }

  @Test
  void sendDelegatesWhenMarkerIsBlank() {
    final LocalChannelAdapter delegate = mock(LocalChannelAdapter.class);
    final FailureInjectingChannelAdapter adapter = adapter(delegate, "", "");

    assertThatCode(() -> adapter.send(NotificationChannel.PRIMARY_CHAT, MARKER))
        .doesNotThrowAnyException();

    verify(delegate).send(NotificationChannel.PRIMARY_CHAT, MARKER);
  }

  private FailureInjectingChannelAdapter adapter(
      LocalChannelAdapter delegate, String marker, String channelName) {
    final FailureInjectingChannelAdapter adapter = new FailureInjectingChannelAdapter(delegate);
    setField(adapter, "textMarker", marker);
    setField(adapter, "channelName", channelName);
    return adapter;
  }

  private void setField(FailureInjectingChannelAdapter adapter, String name, String value) {
    try {
      final Field field = FailureInjectingChannelAdapter.class.getDeclaredField(name);
      field.setAccessible(true);
      field.set(adapter, value);
    } catch (ReflectiveOperationException ex) {
      throw new AssertionError("failed to set " + name + " for test setup", ex);
    }
  }
}
