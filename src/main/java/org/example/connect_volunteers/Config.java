package org.example.connect_volunteers;

import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.config.LedgerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.web.client.RestTemplate;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

@Slf4j
@Configuration
public class Config {

    /**
     * Регистрирует бота в Telegram и запускает long polling.
     * <p>
     * telegram.bot.enabled=false - бот не подключается к Telegram (локальный запуск без токена).
     *
     * @param bot основной Bot
     * @return TelegramBotsApi
     */
    @Bean
    @ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true", matchIfMissing = true)
    TelegramBotsApi telegramBotsApi(Bot bot) {
        try {
            TelegramBotsApi telegramBotsApi = new TelegramBotsApi(DefaultBotSession.class);
            telegramBotsApi.registerBot(bot);
            log.info("Бот @{} зарегистрирован в Telegram", bot.getBotUsername());
            return telegramBotsApi;
        } catch (TelegramApiException e) {
            log.error("Не удалось зарегистрировать бота в Telegram API", e);
            throw new IllegalStateException("Не удалось зарегистрировать Telegram бота. Проверьте токен и подключение к интернету.", e);
        }
    }

    /**
     * HTTP-клиент для Google Sheets с таймаутами: запись заявки не должна висеть вечно.
     */
    @Bean
    RestTemplate sheetsRestTemplate(LedgerConfig ledgerConfig) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(ledgerConfig.getConnectTimeoutMs());
        requestFactory.setReadTimeout(ledgerConfig.getReadTimeoutMs());
        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.getMessageConverters()
                .add(0, new StringHttpMessageConverter(StandardCharsets.UTF_8));
        return restTemplate;
    }

    /**
     * Часы для времени заявки (в тестах подменяются на фиксированные).
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
