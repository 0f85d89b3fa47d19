package org.example.connect_volunteers.service;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.connect_volunteers.config.LedgerConfig;
import org.example.connect_volunteers.exception.LedgerSinkException;
import org.springframework.stereotype.Component;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * OAuth2 токен для Google Sheets API.
 * <p>
 * Ключ сервисного аккаунта читаем один раз (лениво, при первой заявке),
 * токен библиотека обновляет сама, когда он протухает.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SheetsAccessTokenProvider {

    static final String SPREADSHEETS_SCOPE = "https://www.googleapis.com/auth/spreadsheets";

    private final LedgerConfig ledgerConfig;

    private GoogleCredentials credentials;

    /**
     * Действующий access token.
     *
     * @throws LedgerSinkException если ключ не прочитался или Google не выдал токен
     */
    public synchronized String accessToken() {
        try {
            GoogleCredentials current = credentials();
            current.refreshIfExpired();
            AccessToken token = current.getAccessToken();
            if (token == null) {
                throw new LedgerSinkException("Google не выдал access token");
            }
            return token.getTokenValue();
        } catch (IOException e) {
            throw new LedgerSinkException("Не удалось получить access token для Google Sheets", e);
        }
    }

    private GoogleCredentials credentials() throws IOException {
        if (credentials == null) {
            String file = ledgerConfig.getCredentialsFile();
            GoogleCredentials loaded;
            if (file == null || file.isBlank()) {
                log.info("Ключ Google не указан, используем Application Default Credentials");
                loaded = applicationDefaultCredentials();
            } else {
                log.info("Читаем ключ сервисного аккаунта Google: {}", file);
                try (InputStream in = new FileInputStream(file)) {
                    loaded = GoogleCredentials.fromStream(in);
                }
            }
            credentials = loaded.createScoped(List.of(SPREADSHEETS_SCOPE));
        }
        return credentials;
    }

    /**
     * Application Default Credentials: GOOGLE_APPLICATION_CREDENTIALS, gcloud или метаданные GCE.
     */
    GoogleCredentials applicationDefaultCredentials() throws IOException {
        return GoogleCredentials.getApplicationDefault();
    }
}
