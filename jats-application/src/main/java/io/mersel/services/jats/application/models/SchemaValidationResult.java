package io.mersel.services.jats.application.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.mersel.services.jats.application.enums.SchemaValidationStatus;

import java.util.List;

/**
 * {@code validate(tree, schema)} sözleşmesinin sonucu.
 *
 * @param status Doğrulama durumu
 * @param errors Kullanıcı dostu hata mesajları (geçerliyse boş)
 */
public record SchemaValidationResult(
        SchemaValidationStatus status,
        List<String> errors
) {

    public SchemaValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SchemaValidationResult valid() {
        return new SchemaValidationResult(SchemaValidationStatus.VALID, List.of());
    }

    public static SchemaValidationResult invalid(List<String> errors) {
        return new SchemaValidationResult(SchemaValidationStatus.INVALID, errors);
    }

    public static SchemaValidationResult skipped(String reason) {
        return new SchemaValidationResult(SchemaValidationStatus.SKIPPED, List.of(reason));
    }

    @JsonIgnore
    public boolean isValid() {
        return status == SchemaValidationStatus.VALID;
    }
}
