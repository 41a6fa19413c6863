package com.libragraph.sdc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Dataset metadata, stored as {@code meta.json} in the archive root.
 * {@code created} is a free-form, user supplied date of the dataset itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetaAttributes(
        String author,
        String email,
        String organization,
        String comment,
        String title,
        List<String> keywords,
        String description,
        String created,
        String doi,
        String license
) {
    public MetaAttributes {
        keywords = keywords == null ? null : List.copyOf(keywords);
    }

    public static MetaAttributes titled(String title) {
        return new MetaAttributes(null, null, null, null, title, null, null, null, null, null);
    }

    public MetaAttributes withAuthor(String author, String email) {
        return new MetaAttributes(author, email, organization, comment, title, keywords,
                description, created, doi, license);
    }

    public MetaAttributes withTitle(String title) {
        return new MetaAttributes(author, email, organization, comment, title, keywords,
                description, created, doi, license);
    }

    public MetaAttributes withComment(String comment) {
        return new MetaAttributes(author, email, organization, comment, title, keywords,
                description, created, doi, license);
    }

    public MetaAttributes withDescription(String description) {
        return new MetaAttributes(author, email, organization, comment, title, keywords,
                description, created, doi, license);
    }

    public MetaAttributes withKeywords(List<String> keywords) {
        return new MetaAttributes(author, email, organization, comment, title, keywords,
                description, created, doi, license);
    }

    public MetaAttributes withLicense(String license) {
        return new MetaAttributes(author, email, organization, comment, title, keywords,
                description, created, doi, license);
    }
}
