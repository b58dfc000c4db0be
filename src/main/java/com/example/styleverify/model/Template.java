package com.example.styleverify.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Versioned reference document whose styles are the verification baseline.
 * Text styles are embedded and owned by the template version.
 */
@Document(collection = "templates")
public record Template(
        @Id String id,
        String name,
        String description,
        String fileName,
        String filePath,
        String fileHash,
        long fileSize,
        TemplateStatus status,
        int version,
        String createdBy,
        Instant createdOn,
        String modifiedBy,
        Instant modifiedOn,
        List<TextStyle> textStyles
) {
    public Template {
        textStyles = textStyles == null ? List.of() : List.copyOf(textStyles);
        if (status == null) status = TemplateStatus.ACTIVE;
        if (version <= 0) version = 1;
    }

    public boolean isActive() {
        return status == TemplateStatus.ACTIVE;
    }

    public Template withId(String newId) {
        return new Template(newId, name, description, fileName, filePath, fileHash, fileSize, status, version,
                createdBy, createdOn, modifiedBy, modifiedOn, textStyles);
    }

    public Template withStatus(TemplateStatus newStatus, String modifiedBy, Instant modifiedOn) {
        return new Template(id, name, description, fileName, filePath, fileHash, fileSize, newStatus, version,
                createdBy, createdOn, modifiedBy, modifiedOn, textStyles);
    }

    /** Copy stored as a fresh version: no id, given version number, active, given styles. */
    public Template asNewVersion(int newVersion, List<TextStyle> styles, Instant now) {
        return new Template(null, name, description, fileName, filePath, fileHash, fileSize, TemplateStatus.ACTIVE,
                newVersion, createdBy, createdOn != null ? createdOn : now, null, null, styles);
    }
}
