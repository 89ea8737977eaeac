package com.vidnyan.eaf.adapter.out.xml;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

import java.util.List;

/**
 * DTO classes mirroring the EAF XML layout.
 * Element and attribute names follow the EAF 3.0 schema; elements the
 * document model does not carry are skipped on read.
 */
final class EafXml {

    static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    static final String SCHEMA_LOCATION = "http://www.mpi.nl/tools/elan/EAFv3.0.xsd";

    private EafXml() {
    }

    @JacksonXmlRootElement(localName = "ANNOTATION_DOCUMENT")
    @JsonPropertyOrder({"AUTHOR", "DATE", "FORMAT", "VERSION", "noNamespaceSchemaLocation",
            "HEADER", "TIME_ORDER", "TIER", "LINGUISTIC_TYPE", "LOCALE", "LANGUAGE",
            "CONSTRAINT", "CONTROLLED_VOCABULARY"})
    static class DocumentDto {
        @JacksonXmlProperty(isAttribute = true, localName = "AUTHOR")
        public String author;
        @JacksonXmlProperty(isAttribute = true, localName = "DATE")
        public String date;
        @JacksonXmlProperty(isAttribute = true, localName = "FORMAT")
        public String format;
        @JacksonXmlProperty(isAttribute = true, localName = "VERSION")
        public String version;
        @JacksonXmlProperty(isAttribute = true, localName = "noNamespaceSchemaLocation", namespace = XSI_NAMESPACE)
        public String schemaLocation;

        @JacksonXmlProperty(localName = "HEADER")
        public HeaderDto header;
        @JacksonXmlProperty(localName = "TIME_ORDER")
        public TimeOrderDto timeOrder;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "TIER")
        public List<TierDto> tiers;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "LINGUISTIC_TYPE")
        public List<LinguisticTypeDto> linguisticTypes;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "LOCALE")
        public List<LocaleDto> locales;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "LANGUAGE")
        public List<LanguageDto> languages;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "CONSTRAINT")
        public List<ConstraintDto> constraints;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "CONTROLLED_VOCABULARY")
        public List<ControlledVocabularyDto> controlledVocabularies;
    }

    @JsonPropertyOrder({"MEDIA_FILE", "TIME_UNITS", "MEDIA_DESCRIPTOR", "PROPERTY"})
    static class HeaderDto {
        @JacksonXmlProperty(isAttribute = true, localName = "MEDIA_FILE")
        public String mediaFile;
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_UNITS")
        public String timeUnits;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "MEDIA_DESCRIPTOR")
        public List<MediaDescriptorDto> mediaDescriptors;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "PROPERTY")
        public List<PropertyDto> properties;
    }

    static class MediaDescriptorDto {
        @JacksonXmlProperty(isAttribute = true, localName = "MEDIA_URL")
        public String mediaUrl;
        @JacksonXmlProperty(isAttribute = true, localName = "RELATIVE_MEDIA_URL")
        public String relativeMediaUrl;
        @JacksonXmlProperty(isAttribute = true, localName = "MIME_TYPE")
        public String mimeType;
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_ORIGIN")
        public Long timeOrigin;
        @JacksonXmlProperty(isAttribute = true, localName = "EXTRACTED_FROM")
        public String extractedFrom;
    }

    static class PropertyDto {
        @JacksonXmlProperty(isAttribute = true, localName = "NAME")
        public String name;
        @JacksonXmlText
        public String value;
    }

    static class TimeOrderDto {
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "TIME_SLOT")
        public List<TimeSlotDto> timeSlots;
    }

    static class TimeSlotDto {
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_SLOT_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_VALUE")
        public Long value;
    }

    @JsonPropertyOrder({"TIER_ID", "PARTICIPANT", "ANNOTATOR", "LINGUISTIC_TYPE_REF",
            "DEFAULT_LOCALE", "PARENT_REF", "EXT_REF", "LANG_REF", "ANNOTATION"})
    static class TierDto {
        @JacksonXmlProperty(isAttribute = true, localName = "TIER_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "PARTICIPANT")
        public String participant;
        @JacksonXmlProperty(isAttribute = true, localName = "ANNOTATOR")
        public String annotator;
        @JacksonXmlProperty(isAttribute = true, localName = "LINGUISTIC_TYPE_REF")
        public String linguisticTypeRef;
        @JacksonXmlProperty(isAttribute = true, localName = "DEFAULT_LOCALE")
        public String defaultLocale;
        @JacksonXmlProperty(isAttribute = true, localName = "PARENT_REF")
        public String parentRef;
        @JacksonXmlProperty(isAttribute = true, localName = "EXT_REF")
        public String extRef;
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_REF")
        public String langRef;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "ANNOTATION")
        public List<AnnotationDto> annotations;
    }

    /**
     * Holds exactly one of the two annotation variants.
     */
    static class AnnotationDto {
        @JacksonXmlProperty(localName = "ALIGNABLE_ANNOTATION")
        public AlignableAnnotationDto alignable;
        @JacksonXmlProperty(localName = "REF_ANNOTATION")
        public RefAnnotationDto referred;
    }

    @JsonPropertyOrder({"ANNOTATION_ID", "EXT_REF", "LANG_REF", "CVE_REF",
            "TIME_SLOT_REF1", "TIME_SLOT_REF2", "ANNOTATION_VALUE"})
    static class AlignableAnnotationDto {
        @JacksonXmlProperty(isAttribute = true, localName = "ANNOTATION_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "EXT_REF")
        public String extRef;
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_REF")
        public String langRef;
        @JacksonXmlProperty(isAttribute = true, localName = "CVE_REF")
        public String cveRef;
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_SLOT_REF1")
        public String timeSlotRef1;
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_SLOT_REF2")
        public String timeSlotRef2;
        @JacksonXmlProperty(localName = "ANNOTATION_VALUE")
        public String value;
    }

    @JsonPropertyOrder({"ANNOTATION_ID", "EXT_REF", "LANG_REF", "CVE_REF",
            "ANNOTATION_REF", "PREVIOUS_ANNOTATION", "ANNOTATION_VALUE"})
    static class RefAnnotationDto {
        @JacksonXmlProperty(isAttribute = true, localName = "ANNOTATION_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "EXT_REF")
        public String extRef;
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_REF")
        public String langRef;
        @JacksonXmlProperty(isAttribute = true, localName = "CVE_REF")
        public String cveRef;
        @JacksonXmlProperty(isAttribute = true, localName = "ANNOTATION_REF")
        public String annotationRef;
        @JacksonXmlProperty(isAttribute = true, localName = "PREVIOUS_ANNOTATION")
        public String previousAnnotation;
        @JacksonXmlProperty(localName = "ANNOTATION_VALUE")
        public String value;
    }

    static class LinguisticTypeDto {
        @JacksonXmlProperty(isAttribute = true, localName = "LINGUISTIC_TYPE_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "TIME_ALIGNABLE")
        public Boolean timeAlignable;
        @JacksonXmlProperty(isAttribute = true, localName = "CONSTRAINTS")
        public String constraints;
        @JacksonXmlProperty(isAttribute = true, localName = "GRAPHIC_REFERENCES")
        public Boolean graphicReferences;
        @JacksonXmlProperty(isAttribute = true, localName = "CONTROLLED_VOCABULARY_REF")
        public String controlledVocabularyRef;
        @JacksonXmlProperty(isAttribute = true, localName = "EXT_REF")
        public String extRef;
        @JacksonXmlProperty(isAttribute = true, localName = "LEXICON_REF")
        public String lexiconRef;
    }

    static class LocaleDto {
        @JacksonXmlProperty(isAttribute = true, localName = "LANGUAGE_CODE")
        public String languageCode;
        @JacksonXmlProperty(isAttribute = true, localName = "COUNTRY_CODE")
        public String countryCode;
        @JacksonXmlProperty(isAttribute = true, localName = "VARIANT")
        public String variant;
    }

    static class LanguageDto {
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_DEF")
        public String definition;
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_LABEL")
        public String label;
    }

    static class ConstraintDto {
        @JacksonXmlProperty(isAttribute = true, localName = "STEREOTYPE")
        public String stereotype;
        @JacksonXmlProperty(isAttribute = true, localName = "DESCRIPTION")
        public String description;
    }

    @JsonPropertyOrder({"CV_ID", "EXT_REF", "DESCRIPTION", "CV_ENTRY_ML"})
    static class ControlledVocabularyDto {
        @JacksonXmlProperty(isAttribute = true, localName = "CV_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "EXT_REF")
        public String extRef;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "DESCRIPTION")
        public List<DescriptionDto> descriptions;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "CV_ENTRY_ML")
        public List<EntryDto> entries;
    }

    static class DescriptionDto {
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_REF")
        public String langRef;
        @JacksonXmlText
        public String text;
    }

    @JsonPropertyOrder({"CVE_ID", "EXT_REF", "CVE_VALUE"})
    static class EntryDto {
        @JacksonXmlProperty(isAttribute = true, localName = "CVE_ID")
        public String id;
        @JacksonXmlProperty(isAttribute = true, localName = "EXT_REF")
        public String extRef;
        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "CVE_VALUE")
        public List<EntryValueDto> values;
    }

    static class EntryValueDto {
        @JacksonXmlProperty(isAttribute = true, localName = "LANG_REF")
        public String langRef;
        @JacksonXmlProperty(isAttribute = true, localName = "DESCRIPTION")
        public String description;
        @JacksonXmlText
        public String value;
    }
}
