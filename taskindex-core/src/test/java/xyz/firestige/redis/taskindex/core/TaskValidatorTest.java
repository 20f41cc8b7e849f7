package xyz.firestige.redis.taskindex.core;

import org.junit.jupiter.api.Test;
import xyz.firestige.redis.taskindex.api.Task;
import xyz.firestige.redis.taskindex.api.TaskFilter;
import xyz.firestige.redis.taskindex.exception.ErrorKind;
import xyz.firestige.redis.taskindex.exception.TaskValidationException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskValidatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void validateDescription_blank_rejected() {
        assertThrows(TaskValidationException.class, () -> TaskValidator.validateDescription(null));
        assertThrows(TaskValidationException.class, () -> TaskValidator.validateDescription(""));
        assertThrows(TaskValidationException.class, () -> TaskValidator.validateDescription("   \t "));
    }

    @Test
    void validateDescription_atLimit_accepted() {
        String description = "a".repeat(Task.MAX_DESCRIPTION_LENGTH);
        assertThatCode(() -> TaskValidator.validateDescription(description)).doesNotThrowAnyException();
    }

    @Test
    void validateDescription_overLimit_rejected() {
        String description = "a".repeat(Task.MAX_DESCRIPTION_LENGTH + 1);
        assertThatThrownBy(() -> TaskValidator.validateDescription(description))
            .isInstanceOf(TaskValidationException.class)
            .hasMessageContaining("10000");
    }

    @Test
    void validateDescription_countsCodePoints() {
        // 补充平面字符占两个 char，但只算一个字符
        String emoji = new String(Character.toChars(0x1F600));
        String description = emoji.repeat(Task.MAX_DESCRIPTION_LENGTH);
        assertThatCode(() -> TaskValidator.validateDescription(description)).doesNotThrowAnyException();
    }

    @Test
    void validateDescription_surroundingWhitespaceNotCounted() {
        String description = "  " + "a".repeat(Task.MAX_DESCRIPTION_LENGTH) + "  ";
        assertThatCode(() -> TaskValidator.validateDescription(description)).doesNotThrowAnyException();
    }

    @Test
    void validate_missingFields_rejected() {
        Task.Builder valid = Task.builder()
            .id("t1").ownerId("u1").description("x").createdAt(NOW).updatedAt(NOW);

        assertThatCode(() -> TaskValidator.validate(valid.build())).doesNotThrowAnyException();
        assertThrows(TaskValidationException.class, () -> TaskValidator.validate(null));
        assertThrows(TaskValidationException.class, () -> TaskValidator.validate(valid.build().toBuilder().id(" ").build()));
        assertThrows(TaskValidationException.class, () -> TaskValidator.validate(valid.build().toBuilder().ownerId(null).build()));
        assertThrows(TaskValidationException.class, () -> TaskValidator.validate(valid.build().toBuilder().createdAt(null).build()));
    }

    @Test
    void validateFilter_limitBounds() {
        assertThatCode(() -> TaskValidator.validateFilter(TaskFilter.builder().limit(0).build(), 1000))
            .doesNotThrowAnyException();
        assertThatCode(() -> TaskValidator.validateFilter(TaskFilter.builder().limit(1000).build(), 1000))
            .doesNotThrowAnyException();
        assertThrows(TaskValidationException.class,
            () -> TaskValidator.validateFilter(TaskFilter.builder().limit(1001).build(), 1000));
        assertThrows(TaskValidationException.class,
            () -> TaskValidator.validateFilter(TaskFilter.builder().limit(-1).build(), 1000));
    }

    @Test
    void validateFilter_negativeOffset_rejected() {
        TaskValidationException e = assertThrows(TaskValidationException.class,
            () -> TaskValidator.validateFilter(TaskFilter.builder().offset(-1).build(), 1000));
        assertEquals(ErrorKind.VALIDATION, e.getKind());
    }

    @Test
    void requireCategoryName_blank_rejected() {
        assertThrows(TaskValidationException.class, () -> TaskValidator.requireCategoryName(""));
        assertThrows(TaskValidationException.class, () -> TaskValidator.requireCategoryName(" "));
        assertThatCode(() -> TaskValidator.requireCategoryName("work")).doesNotThrowAnyException();
    }
}
