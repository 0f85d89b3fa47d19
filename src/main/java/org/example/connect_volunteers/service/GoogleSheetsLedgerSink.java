package org.example.connect_volunteers.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.config.LedgerConfig;
import org.example.connect_volunteers.exception.LedgerSinkException;
import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.HelpCategory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Запись заявок в Google таблицы через Sheets API v4.
 * <p>
 * Что делает:
 * 1. По категории находит ID таблицы (из {@link LedgerConfig})
 * 2. Собирает строку: ПІБ | телефоны | адрес | комментарий | время
 * 3. POST .../spreadsheets/{id}/values/{лист}:append - Google сам найдёт первую пустую строку
 * <p>
 * Документация: https://developers.google.com/sheets/api/reference/rest/v4/spreadsheets.values/append
 */
@Slf4j
@Service
public class GoogleSheetsLedgerSink implements LedgerSink {

    private static final DateTimeFormatter SECONDS_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter OFFSET_FORMAT = DateTimeFormatter.ofPattern("xxx");

    private final RestTemplate restTemplate;
    private final LedgerConfig ledgerConfig;
    private final SheetsAccessTokenProvider tokenProvider;

    public GoogleSheetsLedgerSink(@Qualifier("sheetsRestTemplate") RestTemplate restTemplate,
                                  LedgerConfig ledgerConfig,
                                  SheetsAccessTokenProvider tokenProvider) {
        this.restTemplate = restTemplate;
        this.ledgerConfig = ledgerConfig;
        this.tokenProvider = tokenProvider;
    }

    /**
     * Тело запроса values:append.
     */
    public record ValueRange(String majorDimension, List<List<String>> values) {
    }

    @Override
    public void append(HelpCategory category, ContactRecord record, OffsetDateTime committedAt) {
        if (record == null || !record.isComplete()) {
            throw new LedgerSinkException("Анкета заполнена не полностью: " + record);
        }

        String spreadsheetId = ledgerConfig.spreadsheetIdFor(category);
        URI uri = UriComponentsBuilder.fromHttpUrl(ledgerConfig.getApiBaseUrl())
                .path("/v4/spreadsheets/{spreadsheetId}/values/{range}:append")
                .queryParam("valueInputOption", "USER_ENTERED")
                .queryParam("includeValuesInResponse", true)
                .buildAndExpand(spreadsheetId, ledgerConfig.getSheetName())
                .encode()
                .toUri();

        ValueRange body = new ValueRange("ROWS", List.of(List.of(
                record.fullName(),
                record.phoneNumbers(),
                record.address(),
                record.comments(),
                formatTimestamp(committedAt)
        )));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(tokenProvider.accessToken());

        log.debug("Sheets append: category={}, spreadsheetId={}", category, spreadsheetId);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);
            log.info("Строка добавлена в таблицу: category={}, updatedRange={}",
                    category, updatedRange(response.getBody()));
        } catch (RestClientException e) {
            throw new LedgerSinkException(
                    "Sheets API не принял строку: category=" + category + ", spreadsheetId=" + spreadsheetId, e);
        }
    }

    /**
     * Время для таблицы: "2022-03-05 14:07:31 +03:00", с долями секунды "2022-03-05 14:07:31.250 +03:00".
     * Доли секунды пишем только если они есть: 3, 6 или 9 знаков (мс, мкс, нс).
     */
    static String formatTimestamp(OffsetDateTime time) {
        StringBuilder text = new StringBuilder(SECONDS_FORMAT.format(time));
        int nanos = time.getNano();
        if (nanos != 0) {
            if (nanos % 1_000_000 == 0) {
                text.append(String.format(Locale.ROOT, ".%03d", nanos / 1_000_000));
            } else if (nanos % 1_000 == 0) {
                text.append(String.format(Locale.ROOT, ".%06d", nanos / 1_000));
            } else {
                text.append(String.format(Locale.ROOT, ".%09d", nanos));
            }
        }
        return text.append(' ').append(OFFSET_FORMAT.format(time)).toString();
    }

    private String updatedRange(JsonNode responseBody) {
        if (responseBody == null) {
            return "?";
        }
        return responseBody.path("updates").path("updatedRange").asText("?");
    }
}
