package org.example.connect_volunteers.service;

import org.example.connect_volunteers.config.LedgerConfig;
import org.example.connect_volunteers.exception.LedgerSinkException;
import org.example.connect_volunteers.model.ContactRecord;
import org.example.connect_volunteers.model.HelpCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("GoogleSheetsLedgerSink")
class GoogleSheetsLedgerSinkTest {

    private static final ContactRecord COMPLETE = new ContactRecord("Jane Doe", "555-0100", "12 Main St", "-");
    private static final OffsetDateTime COMMITTED_AT = OffsetDateTime.parse("2022-03-05T14:07:31+03:00");

    private MockRestServiceServer server;
    private GoogleSheetsLedgerSink sink;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        LedgerConfig config = SessionDriverTest.ledgerConfig();
        SheetsAccessTokenProvider tokenProvider = mock(SheetsAccessTokenProvider.class);
        when(tokenProvider.accessToken()).thenReturn("token-123");

        sink = new GoogleSheetsLedgerSink(restTemplate, config, tokenProvider);
    }

    @Test
    @DisplayName("Одна строка в таблицу своей категории: поля + время")
    void appendsRowToCategorySpreadsheet() {
        server.expect(requestTo("https://sheets.googleapis.com/v4/spreadsheets/evacuation/values/Sheet1:append"
                        + "?valueInputOption=USER_ENTERED&includeValuesInResponse=true"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-123"))
                .andExpect(content().json("{\"majorDimension\":\"ROWS\",\"values\":"
                        + "[[\"Jane Doe\",\"555-0100\",\"12 Main St\",\"-\",\"2022-03-05 14:07:31 +03:00\"]]}", true))
                .andRespond(withSuccess("{\"updates\":{\"updatedRange\":\"Sheet1!A7:E7\"}}",
                        MediaType.APPLICATION_JSON));

        sink.append(HelpCategory.NEED_EVACUATION, COMPLETE, COMMITTED_AT);

        server.verify();
    }

    @Test
    @DisplayName("Доли секунды в таблице: только если есть, по 3/6/9 знаков")
    void timestampKeepsFractionOfSecond() {
        assertThat(GoogleSheetsLedgerSink.formatTimestamp(COMMITTED_AT))
                .isEqualTo("2022-03-05 14:07:31 +03:00");
        assertThat(GoogleSheetsLedgerSink.formatTimestamp(COMMITTED_AT.withNano(250_000_000)))
                .isEqualTo("2022-03-05 14:07:31.250 +03:00");
        assertThat(GoogleSheetsLedgerSink.formatTimestamp(COMMITTED_AT.withNano(123_456_000)))
                .isEqualTo("2022-03-05 14:07:31.123456 +03:00");
        assertThat(GoogleSheetsLedgerSink.formatTimestamp(COMMITTED_AT.withNano(5)))
                .isEqualTo("2022-03-05 14:07:31.000000005 +03:00");
    }

    @Test
    @DisplayName("Время с долями секунды уходит в строку таблицы")
    void appendsTimestampWithFraction() {
        server.expect(requestTo("https://sheets.googleapis.com/v4/spreadsheets/useful/values/Sheet1:append"
                        + "?valueInputOption=USER_ENTERED&includeValuesInResponse=true"))
                .andExpect(content().json("{\"majorDimension\":\"ROWS\",\"values\":"
                        + "[[\"Jane Doe\",\"555-0100\",\"12 Main St\",\"-\",\"2022-03-05 14:07:31.250 +03:00\"]]}", true))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        sink.append(HelpCategory.PROVIDING_USEFUL_CONTACT, COMPLETE, COMMITTED_AT.withNano(250_000_000));

        server.verify();
    }

    @Test
    @DisplayName("Ошибка Sheets API → LedgerSinkException")
    void apiErrorBecomesLedgerSinkException() {
        server.expect(requestTo("https://sheets.googleapis.com/v4/spreadsheets/driver/values/Sheet1:append"
                        + "?valueInputOption=USER_ENTERED&includeValuesInResponse=true"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> sink.append(HelpCategory.PROVIDING_DRIVER, COMPLETE, COMMITTED_AT))
                .isInstanceOf(LedgerSinkException.class)
                .hasMessageContaining("PROVIDING_DRIVER");
    }

    @Test
    @DisplayName("Неполную анкету не пишем")
    void rejectsIncompleteRecord() {
        ContactRecord partial = new ContactRecord("Jane Doe", "555-0100", null, null);

        assertThatThrownBy(() -> sink.append(HelpCategory.PROVIDING_DRIVER, partial, COMMITTED_AT))
                .isInstanceOf(LedgerSinkException.class);
        server.verify();
    }
}
