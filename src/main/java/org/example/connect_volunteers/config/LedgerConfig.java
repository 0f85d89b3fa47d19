package org.example.connect_volunteers.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.model.HelpCategory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Конфигурация журнала заявок (Google таблицы).
 * <p>
 * Одна таблица на категорию. ID таблиц и прочее - в application.properties,
 * поэтому один и тот же код можно развернуть для другой команды волонтёров.
 * <p>
 * Объект собирается один раз при старте и дальше не меняется.
 */
@Slf4j
@Getter
@Configuration
public class LedgerConfig {

    /**
     * ID таблицы для каждой категории.
     */
    private final Map<HelpCategory, String> spreadsheetIds;

    /**
     * Лист, в конец которого дописываем строки. Например: "Sheet1"
     */
    private final String sheetName;

    /**
     * Часовой пояс для времени заявки. Например: "+03:00"
     */
    private final ZoneOffset zoneOffset;

    /**
     * Базовый URL Sheets API (в тестах подменяется).
     */
    private final String apiBaseUrl;

    /**
     * JSON-ключ сервисного аккаунта Google. Пусто - берём Application Default Credentials.
     */
    private final String credentialsFile;

    private final int connectTimeoutMs;

    private final int readTimeoutMs;

    public LedgerConfig(
            @Value("${app.ledger.spreadsheet.providing-driver}") String providingDriver,
            @Value("${app.ledger.spreadsheet.providing-collecting-humanitarian-help}") String providingCollecting,
            @Value("${app.ledger.spreadsheet.providing-useful-contact}") String providingUsefulContact,
            @Value("${app.ledger.spreadsheet.need-evacuation}") String needEvacuation,
            @Value("${app.ledger.spreadsheet.need-humanitarian-help}") String needHumanitarianHelp,
            @Value("${app.ledger.sheet-name:Sheet1}") String sheetName,
            @Value("${app.ledger.zone-offset:+03:00}") String zoneOffset,
            @Value("${app.ledger.api-base-url:https://sheets.googleapis.com}") String apiBaseUrl,
            @Value("${app.ledger.credentials-file:}") String credentialsFile,
            @Value("${app.ledger.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${app.ledger.read-timeout-ms:10000}") int readTimeoutMs) {
        Map<HelpCategory, String> ids = new EnumMap<>(HelpCategory.class);
        ids.put(HelpCategory.PROVIDING_DRIVER, providingDriver);
        ids.put(HelpCategory.PROVIDING_COLLECTING_HUMANITARIAN_HELP, providingCollecting);
        ids.put(HelpCategory.PROVIDING_USEFUL_CONTACT, providingUsefulContact);
        ids.put(HelpCategory.NEED_EVACUATION, needEvacuation);
        ids.put(HelpCategory.NEED_HUMANITARIAN_HELP, needHumanitarianHelp);
        ids.forEach((category, id) -> {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Не задан ID таблицы для категории " + category);
            }
        });
        this.spreadsheetIds = Collections.unmodifiableMap(ids);
        this.sheetName = sheetName;
        this.zoneOffset = ZoneOffset.of(zoneOffset);
        this.apiBaseUrl = apiBaseUrl;
        this.credentialsFile = credentialsFile;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @PostConstruct
    public void init() {
        log.info("===========================================");
        log.info("ЖУРНАЛ ЗАЯВОК: лист '{}', часовой пояс {}", sheetName, zoneOffset);
        spreadsheetIds.forEach((category, id) -> log.info("  {} → {}", category, id));
        log.info("===========================================");
    }

    /**
     * ID таблицы, в которую пишем заявки этой категории.
     */
    public String spreadsheetIdFor(HelpCategory category) {
        return spreadsheetIds.get(category);
    }
}
