package org.example.connect_volunteers.service;

import org.example.connect_volunteers.dialogue.Reply;
import org.example.connect_volunteers.exception.TransportException;
import org.example.connect_volunteers.model.SessionKey;

/**
 * Куда отправлять ответы бота (в проде - Telegram).
 */
public interface ReplyTransport {

    /**
     * Отправить ответ в чат.
     *
     * @throws TransportException если отправить не получилось (в том числе по таймауту)
     */
    void send(SessionKey key, Reply reply);
}
