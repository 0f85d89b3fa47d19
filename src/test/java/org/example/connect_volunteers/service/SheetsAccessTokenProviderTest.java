package org.example.connect_volunteers.service;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import org.example.connect_volunteers.config.LedgerConfig;
import org.example.connect_volunteers.exception.LedgerSinkException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SheetsAccessTokenProvider")
class SheetsAccessTokenProviderTest {

    private static LedgerConfig configWithCredentials(String credentialsFile) {
        return new LedgerConfig("driver", "collecting", "useful", "evacuation", "humanitarian",
                "Sheet1", "+03:00", "https://sheets.googleapis.com", credentialsFile, 1000, 1000);
    }

    @Test
    @DisplayName("Путь к ключу пустой → Application Default Credentials, читаем один раз")
    void blankCredentialsFileUsesApplicationDefault() {
        AtomicInteger lookups = new AtomicInteger();
        Date expiresAt = Date.from(Instant.now().plus(1, ChronoUnit.HOURS));
        SheetsAccessTokenProvider provider = new SheetsAccessTokenProvider(configWithCredentials("  ")) {
            @Override
            GoogleCredentials applicationDefaultCredentials() {
                lookups.incrementAndGet();
                return GoogleCredentials.create(new AccessToken("adc-token", expiresAt));
            }
        };

        assertThat(provider.accessToken()).isEqualTo("adc-token");
        assertThat(provider.accessToken()).isEqualTo("adc-token");
        assertThat(lookups).hasValue(1);
    }

    @Test
    @DisplayName("ADC недоступны → LedgerSinkException")
    void missingApplicationDefaultBecomesLedgerSinkException() {
        SheetsAccessTokenProvider provider = new SheetsAccessTokenProvider(configWithCredentials("")) {
            @Override
            GoogleCredentials applicationDefaultCredentials() throws IOException {
                throw new IOException("The Application Default Credentials are not available");
            }
        };

        assertThatThrownBy(provider::accessToken)
                .isInstanceOf(LedgerSinkException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Файла с ключом нет → LedgerSinkException")
    void unreadableCredentialsFileBecomesLedgerSinkException(@TempDir Path dir) {
        String missing = dir.resolve("no-such-key.json").toString();
        SheetsAccessTokenProvider provider = new SheetsAccessTokenProvider(configWithCredentials(missing));

        assertThatThrownBy(provider::accessToken)
                .isInstanceOf(LedgerSinkException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Ключ не похож на ключ сервисного аккаунта → LedgerSinkException")
    void malformedCredentialsFileBecomesLedgerSinkException(@TempDir Path dir) throws IOException {
        Path key = dir.resolve("key.json");
        Files.writeString(key, "{\"type\":\"unknown\"}", StandardCharsets.UTF_8);
        SheetsAccessTokenProvider provider = new SheetsAccessTokenProvider(configWithCredentials(key.toString()));

        assertThatThrownBy(provider::accessToken)
                .isInstanceOf(LedgerSinkException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
