package com.sandwichtrader.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.sandwichtrader.domain.enums.AlertSeverity;
import com.sandwichtrader.domain.enums.AlertType;
import com.sandwichtrader.domain.enums.LifecycleState;
import com.sandwichtrader.event.StrategyEvent;
import com.sandwichtrader.event.StrategyEventType;
import com.sandwichtrader.notification.Alert;
import com.sandwichtrader.notification.NotificationService;
import com.sandwichtrader.notification.NotificationTemplateEngine;
import com.sandwichtrader.notification.TelegramNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private TelegramNotifier telegramNotifier;

    @Mock
    private NotificationTemplateEngine notificationTemplateEngine;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(telegramNotifier, notificationTemplateEngine);
    }

    @ParameterizedTest(name = "{0} -> {1}/{2}")
    @CsvSource({
        "ENTERED, ENTRY, INFO",
        "ENTRY_REJECTED, ENTRY_REJECTED, WARNING",
        "ADJUSTED, ADJUSTMENT, WARNING",
        "CLOSED, EXIT, INFO",
        "ORDER_FAILED, ORDER_FAILURE, CRITICAL"
    })
    @DisplayName("Strategy events map to alert type and severity")
    void onStrategyEvent_mapsTypeAndSeverity(
            StrategyEventType eventType, AlertType expectedType, AlertSeverity expectedSeverity) {
        when(notificationTemplateEngine.render(any())).thenReturn("rendered");

        notificationService.onStrategyEvent(new StrategyEvent(
                this, eventType, LifecycleState.ACTIVE, LifecycleState.DEFENSE_1, "message", null));

        ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
        verify(notificationTemplateEngine).render(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(expectedType);
        assertThat(captor.getValue().getSeverity()).isEqualTo(expectedSeverity);
        assertThat(captor.getValue().getTitle()).isEqualTo(eventType.name() + " (ACTIVE -> DEFENSE_1)");
        verify(telegramNotifier).send("rendered", expectedSeverity);
    }

    @Test
    @DisplayName("Delivery failure never propagates")
    void notify_swallowsFailure() {
        when(notificationTemplateEngine.render(any())).thenReturn("rendered");
        doThrow(new IllegalStateException("boom")).when(telegramNotifier).send(anyString(), eq(AlertSeverity.INFO));

        Alert alert = Alert.builder()
                .type(AlertType.ENTRY)
                .severity(AlertSeverity.INFO)
                .title("ENTERED")
                .message("Sandwich entered")
                .build();

        assertThatCode(() -> notificationService.notify(alert)).doesNotThrowAnyException();
    }
}
