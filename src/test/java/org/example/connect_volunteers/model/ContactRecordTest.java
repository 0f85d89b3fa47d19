package org.example.connect_volunteers.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ContactRecord")
class ContactRecordTest {

    @Test
    @DisplayName("Поля заполняются строго по порядку")
    void fillsFieldsInOrder() {
        ContactRecord record = ContactRecord.empty()
                .withNext("Jane Doe")
                .withNext("555-0100")
                .withNext("12 Main St");

        assertThat(record.fullName()).isEqualTo("Jane Doe");
        assertThat(record.phoneNumbers()).isEqualTo("555-0100");
        assertThat(record.address()).isEqualTo("12 Main St");
        assertThat(record.comments()).isNull();
        assertThat(record.nextMissingField()).contains(ContactField.COMMENTS);
        assertThat(record.isComplete()).isFalse();

        ContactRecord complete = record.withNext("-");
        assertThat(complete.isComplete()).isTrue();
        assertThat(complete.nextMissingField()).isEmpty();
    }

    @Test
    @DisplayName("Пустая строка не считается заполненным полем")
    void emptyStringIsNotSet() {
        ContactRecord record = new ContactRecord("Jane Doe", "", null, null);

        assertThat(record.isSet(ContactField.PHONE_NUMBERS)).isFalse();
        assertThat(record.nextMissingField()).contains(ContactField.PHONE_NUMBERS);
    }

    @Test
    @DisplayName("Дырка в анкете - не префикс")
    void detectsGaps() {
        assertThat(ContactRecord.empty().isOrderedPrefix()).isTrue();
        assertThat(new ContactRecord("a", "b", null, null).isOrderedPrefix()).isTrue();
        assertThat(new ContactRecord("a", null, "c", null).isOrderedPrefix()).isFalse();
        assertThat(new ContactRecord(null, null, null, "d").isOrderedPrefix()).isFalse();
    }

    @Test
    @DisplayName("В полную анкету или анкету с дыркой дописать нельзя")
    void refusesToExtendCompleteOrBrokenRecord() {
        ContactRecord complete = new ContactRecord("a", "b", "c", "d");
        ContactRecord broken = new ContactRecord("a", null, "c", null);

        assertThatThrownBy(() -> complete.withNext("e")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> broken.withNext("e")).isInstanceOf(IllegalStateException.class);
    }
}
