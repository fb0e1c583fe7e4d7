package com.menuvo.menuImport.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.menuvo.menuImport.extraction.exception.UnsupportedFormatException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Menu file formats accepted for import.
 */
public enum MenuFileType {

    XLSX("xlsx"),
    CSV("csv"),
    JSON("json"),
    MD("md"),
    TXT("txt");

    private static final Map<String, MenuFileType> MIME_TYPES = Map.of(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", XLSX,
            "application/vnd.ms-excel", XLSX,
            "text/csv", CSV,
            "application/json", JSON,
            "text/markdown", MD,
            "text/plain", TXT
    );

    private final String extension;

    MenuFileType(String extension) {
        this.extension = extension;
    }

    @JsonValue
    public String getExtension() {
        return extension;
    }

    /**
     * Resolves a declared format ("xlsx", "CSV", ...).
     *
     * @throws UnsupportedFormatException if the value names no supported format
     */
    public static MenuFileType fromValue(String value) {
        return fromExtension(value)
                .orElseThrow(() -> new UnsupportedFormatException(
                        "Unsupported file type: " + value + ". Allowed types: " + allowedExtensions()));
    }

    public static Optional<MenuFileType> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.extension.equals(normalized))
                .findFirst();
    }

    public static Optional<MenuFileType> fromMimeType(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        int parameters = mimeType.indexOf(';');
        String baseType = parameters >= 0 ? mimeType.substring(0, parameters) : mimeType;
        return Optional.ofNullable(MIME_TYPES.get(baseType.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves the type of an uploaded file from its MIME type, falling back to the file name extension.
     */
    public static MenuFileType resolve(String mimeType, String filename) {
        return fromMimeType(mimeType)
                .or(() -> fromExtension(extensionOf(filename)))
                .orElseThrow(() -> new UnsupportedFormatException(
                        "Unsupported file type: " + mimeType + ". Allowed types: " + allowedExtensions()));
    }

    public static String allowedExtensions() {
        return Arrays.stream(values()).map(MenuFileType::getExtension).collect(Collectors.joining(", "));
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot + 1) : null;
    }
}
