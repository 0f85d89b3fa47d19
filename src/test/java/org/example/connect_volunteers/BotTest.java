package org.example.connect_volunteers;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.bots.DefaultBotOptions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Bot")
class BotTest {

    @Test
    @DisplayName("Таймауты запросов к Telegram берутся из настроек")
    void requestTimeoutsAreApplied() {
        DefaultBotOptions options = Bot.botOptions(30000, 20);

        assertThat(options.getGetUpdatesTimeout()).isEqualTo(20);
        assertThat(options.getRequestConfig().getSocketTimeout()).isEqualTo(30000);
        assertThat(options.getRequestConfig().getConnectTimeout()).isEqualTo(30000);
    }

    @Test
    @DisplayName("Long polling дольше таймаута сокета - ошибка конфигурации")
    void updatesTimeoutMustBeShorterThanSocketTimeout() {
        assertThatThrownBy(() -> Bot.botOptions(10000, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
