package org.example.connect_volunteers.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Категории заявок.
 * <p>
 * Каждая категория - это отдельная таблица у волонтёров.
 * Порядок констант = порядок кнопок в меню.
 */
public enum HelpCategory {

    // ============================================
    // ПРЕДЛАГАЮТ ПОМОЩЬ
    // ============================================

    /** Водитель с собственным авто (помогает с эвакуацией) */
    PROVIDING_DRIVER(Direction.PROVIDING, "Я водій з власним авто"),

    /** Может собирать гуманитарную или финансовую помощь */
    PROVIDING_COLLECTING_HUMANITARIAN_HELP(Direction.PROVIDING, "Можу збирати гуманітарну чи фінансову допомогу"),

    /** Полезные контакты */
    PROVIDING_USEFUL_CONTACT(Direction.PROVIDING, "Корисні контакти"),

    // ============================================
    // ПРОСЯТ ПОМОЩЬ
    // ============================================

    /** Нужна эвакуация */
    NEED_EVACUATION(Direction.REQUESTING, "Евакуація"),

    /** Нужна гуманитарная помощь */
    NEED_HUMANITARIAN_HELP(Direction.REQUESTING, "Потрібна гуманітарна допомога");

    /**
     * Кто пишет боту: тот, кто помогает, или тот, кому нужна помощь.
     */
    public enum Direction {
        PROVIDING,
        REQUESTING
    }

    private final Direction direction;
    private final String label;

    HelpCategory(Direction direction, String label) {
        this.direction = direction;
        this.label = label;
    }

    /**
     * Текст кнопки. Юзер присылает его обратно как обычное сообщение.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Найти категорию по тексту кнопки.
     * Ищем только среди категорий нужного направления: из меню "допомогти"
     * нельзя выбрать "Евакуація".
     */
    public static Optional<HelpCategory> fromLabel(Direction direction, String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(category -> category.direction == direction)
                .filter(category -> category.label.equals(text))
                .findFirst();
    }

    /**
     * Тексты кнопок меню для направления (в порядке объявления).
     */
    public static List<String> labelsOf(Direction direction) {
        return Arrays.stream(values())
                .filter(category -> category.direction == direction)
                .map(HelpCategory::getLabel)
                .toList();
    }
}
