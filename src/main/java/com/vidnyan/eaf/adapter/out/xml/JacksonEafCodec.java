package com.vidnyan.eaf.adapter.out.xml;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.vidnyan.eaf.adapter.out.xml.EafXml.*;
import com.vidnyan.eaf.application.port.out.EafCodec;
import com.vidnyan.eaf.config.EafProperties;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.*;
import com.vidnyan.eaf.domain.model.meta.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * EAF codec built on Jackson's XML data format.
 * Maps between the XML DTOs and the immutable document model.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JacksonEafCodec implements EafCodec {

    private final XmlMapper xmlMapper;
    private final EafProperties properties;

    @Override
    public EafDocument decode(byte[] content) {
        DocumentDto dto;
        try {
            dto = xmlMapper.readValue(content, DocumentDto.class);
        } catch (IOException e) {
            throw new EafException(EafError.CODEC, EafError.CODEC.format(e.getMessage()), e);
        }
        if (dto == null) {
            throw EafException.of(EafError.CODEC, "empty document");
        }
        EafDocument document = mapToDocument(dto);
        log.debug("Decoded {} tiers, {} annotations, {} time slots",
                document.tierCount(), document.annotationCount(), document.timeOrder().size());
        return document;
    }

    @Override
    public byte[] encode(EafDocument document) {
        ObjectWriter writer = properties.isPrettyPrint()
                ? xmlMapper.writer().with(SerializationFeature.INDENT_OUTPUT)
                : xmlMapper.writer();
        try {
            return writer.writeValueAsBytes(mapToDto(document));
        } catch (IOException e) {
            throw new EafException(EafError.CODEC, EafError.CODEC.format(e.getMessage()), e);
        }
    }

    // XML -> model

    private EafDocument mapToDocument(DocumentDto dto) {
        return EafDocument.builder()
                .author(dto.author)
                .date(dto.date)
                .format(dto.format)
                .version(dto.version)
                .header(mapHeader(dto.header))
                .timeOrder(mapTimeOrder(dto.timeOrder))
                .tiers(mapAll(dto.tiers, this::mapTier))
                .linguisticTypes(mapAll(dto.linguisticTypes, this::mapLinguisticType))
                .locales(mapAll(dto.locales, l -> new Locale(l.languageCode, l.countryCode, l.variant)))
                .languages(mapAll(dto.languages, l -> new Language(l.id, l.definition, l.label)))
                .constraints(mapAll(dto.constraints, this::mapConstraint).stream()
                        .flatMap(Optional::stream)
                        .toList())
                .controlledVocabularies(mapAll(dto.controlledVocabularies, this::mapControlledVocabulary))
                .build();
    }

    private Header mapHeader(HeaderDto dto) {
        if (dto == null) return Header.empty();
        return new Header(
                dto.mediaFile,
                dto.timeUnits,
                mapAll(dto.mediaDescriptors, m -> new MediaDescriptor(
                        m.mediaUrl, m.relativeMediaUrl, m.mimeType, m.timeOrigin, m.extractedFrom)),
                mapAll(dto.properties, p -> new Property(p.name, p.value))
        );
    }

    private TimeOrder mapTimeOrder(TimeOrderDto dto) {
        if (dto == null) return TimeOrder.empty();
        return new TimeOrder(mapAll(dto.timeSlots,
                ts -> new TimeSlot(require(ts.id, "TIME_SLOT_ID"), ts.value)));
    }

    private Tier mapTier(TierDto dto) {
        return Tier.builder()
                .id(require(dto.id, "TIER_ID"))
                .participant(dto.participant)
                .annotator(dto.annotator)
                .linguisticTypeRef(dto.linguisticTypeRef)
                .defaultLocale(dto.defaultLocale)
                .parentRef(dto.parentRef)
                .extRef(dto.extRef)
                .langRef(dto.langRef)
                .annotations(mapAll(dto.annotations, this::mapAnnotation))
                .build();
    }

    private Annotation mapAnnotation(AnnotationDto dto) {
        if (dto.alignable != null) {
            AlignableAnnotationDto a = dto.alignable;
            return new AlignableAnnotation(require(a.id, "ANNOTATION_ID"), a.timeSlotRef1, a.timeSlotRef2,
                    AnnotationValue.of(a.value), a.extRef, a.langRef, a.cveRef);
        }
        if (dto.referred != null) {
            RefAnnotationDto r = dto.referred;
            return new RefAnnotation(require(r.id, "ANNOTATION_ID"), require(r.annotationRef, "ANNOTATION_REF"),
                    r.previousAnnotation, AnnotationValue.of(r.value), r.extRef, r.langRef, r.cveRef);
        }
        throw EafException.of(EafError.CODEC, "ANNOTATION without ALIGNABLE_ANNOTATION or REF_ANNOTATION");
    }

    private LinguisticType mapLinguisticType(LinguisticTypeDto dto) {
        return LinguisticType.builder()
                .id(require(dto.id, "LINGUISTIC_TYPE_ID"))
                .timeAlignable(dto.timeAlignable)
                .constraint(mapStereoType(dto.constraints).orElse(null))
                .graphicReferences(dto.graphicReferences)
                .controlledVocabularyRef(dto.controlledVocabularyRef)
                .extRef(dto.extRef)
                .lexiconRef(dto.lexiconRef)
                .build();
    }

    private Optional<Constraint> mapConstraint(ConstraintDto dto) {
        return mapStereoType(dto.stereotype)
                .map(s -> new Constraint(s, dto.description != null ? dto.description : s.description()));
    }

    private Optional<StereoType> mapStereoType(String name) {
        if (name == null) return Optional.empty();
        Optional<StereoType> stereotype = StereoType.fromXmlName(name);
        if (stereotype.isEmpty()) {
            log.warn("Unknown stereotype '{}' ignored", name);
        }
        return stereotype;
    }

    private ControlledVocabulary mapControlledVocabulary(ControlledVocabularyDto dto) {
        return new ControlledVocabulary(
                require(dto.id, "CV_ID"),
                dto.extRef,
                mapAll(dto.descriptions, d -> new ControlledVocabulary.Description(d.langRef, d.text)),
                mapAll(dto.entries, e -> new ControlledVocabulary.Entry(e.id, e.extRef,
                        mapAll(e.values, v -> new ControlledVocabulary.EntryValue(v.langRef, v.description, v.value))))
        );
    }

    // model -> XML

    private DocumentDto mapToDto(EafDocument document) {
        DocumentDto dto = new DocumentDto();
        dto.author = document.author();
        dto.date = document.date() != null
                ? document.date()
                : OffsetDateTime.now().truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        dto.format = document.format();
        dto.version = document.version();
        dto.schemaLocation = EafXml.SCHEMA_LOCATION;
        dto.header = mapHeaderDto(document.header());
        dto.timeOrder = mapTimeOrderDto(document.timeOrder());
        dto.tiers = mapAll(document.tiers(), this::mapTierDto);
        dto.linguisticTypes = mapAll(document.linguisticTypes(), this::mapLinguisticTypeDto);
        dto.locales = mapAll(document.locales(), l -> {
            LocaleDto d = new LocaleDto();
            d.languageCode = l.languageCode();
            d.countryCode = l.countryCode();
            d.variant = l.variant();
            return d;
        });
        dto.languages = mapAll(document.languages(), l -> {
            LanguageDto d = new LanguageDto();
            d.id = l.id();
            d.definition = l.definition();
            d.label = l.label();
            return d;
        });
        dto.constraints = mapAll(document.constraints(), c -> {
            ConstraintDto d = new ConstraintDto();
            d.stereotype = c.stereotype().xmlName();
            d.description = c.description();
            return d;
        });
        dto.controlledVocabularies = mapAll(document.controlledVocabularies(), this::mapControlledVocabularyDto);
        return dto;
    }

    private HeaderDto mapHeaderDto(Header header) {
        HeaderDto dto = new HeaderDto();
        dto.mediaFile = header.mediaFile();
        dto.timeUnits = header.timeUnits();
        dto.mediaDescriptors = mapAll(header.mediaDescriptors(), m -> {
            MediaDescriptorDto d = new MediaDescriptorDto();
            d.mediaUrl = m.mediaUrl();
            d.relativeMediaUrl = m.relativeMediaUrl();
            d.mimeType = m.mimeType();
            d.timeOrigin = m.timeOrigin();
            d.extractedFrom = m.extractedFrom();
            return d;
        });
        dto.properties = mapAll(header.properties(), p -> {
            PropertyDto d = new PropertyDto();
            d.name = p.name();
            d.value = p.value();
            return d;
        });
        return dto;
    }

    private TimeOrderDto mapTimeOrderDto(TimeOrder timeOrder) {
        TimeOrderDto dto = new TimeOrderDto();
        dto.timeSlots = mapAll(timeOrder.timeSlots(), ts -> {
            TimeSlotDto d = new TimeSlotDto();
            d.id = ts.id();
            d.value = ts.value();
            return d;
        });
        return dto;
    }

    private TierDto mapTierDto(Tier tier) {
        TierDto dto = new TierDto();
        dto.id = tier.id();
        dto.participant = tier.participant();
        dto.annotator = tier.annotator();
        dto.linguisticTypeRef = tier.linguisticTypeRef();
        dto.defaultLocale = tier.defaultLocale();
        dto.parentRef = tier.parentRef();
        dto.extRef = tier.extRef();
        dto.langRef = tier.langRef();
        dto.annotations = mapAll(tier.annotations(), this::mapAnnotationDto);
        return dto;
    }

    private AnnotationDto mapAnnotationDto(Annotation annotation) {
        AnnotationDto dto = new AnnotationDto();
        if (annotation instanceof AlignableAnnotation al) {
            AlignableAnnotationDto a = new AlignableAnnotationDto();
            a.id = al.id();
            a.extRef = al.extRef();
            a.langRef = al.langRef();
            a.cveRef = al.cveRef();
            a.timeSlotRef1 = al.timeSlotRef1();
            a.timeSlotRef2 = al.timeSlotRef2();
            a.value = al.text();
            dto.alignable = a;
        } else if (annotation instanceof RefAnnotation ref) {
            RefAnnotationDto r = new RefAnnotationDto();
            r.id = ref.id();
            r.extRef = ref.extRef();
            r.langRef = ref.langRef();
            r.cveRef = ref.cveRef();
            r.annotationRef = ref.annotationRef();
            r.previousAnnotation = ref.previousAnnotation();
            r.value = ref.text();
            dto.referred = r;
        }
        return dto;
    }

    private LinguisticTypeDto mapLinguisticTypeDto(LinguisticType type) {
        LinguisticTypeDto dto = new LinguisticTypeDto();
        dto.id = type.id();
        dto.timeAlignable = type.timeAlignable();
        dto.constraints = type.constraint() != null ? type.constraint().xmlName() : null;
        dto.graphicReferences = type.graphicReferences();
        dto.controlledVocabularyRef = type.controlledVocabularyRef();
        dto.extRef = type.extRef();
        dto.lexiconRef = type.lexiconRef();
        return dto;
    }

    private ControlledVocabularyDto mapControlledVocabularyDto(ControlledVocabulary cv) {
        ControlledVocabularyDto dto = new ControlledVocabularyDto();
        dto.id = cv.id();
        dto.extRef = cv.extRef();
        dto.descriptions = mapAll(cv.descriptions(), d -> {
            DescriptionDto dd = new DescriptionDto();
            dd.langRef = d.langRef();
            dd.text = d.text();
            return dd;
        });
        dto.entries = mapAll(cv.entries(), e -> {
            EntryDto ed = new EntryDto();
            ed.id = e.id();
            ed.extRef = e.extRef();
            ed.values = mapAll(e.values(), v -> {
                EntryValueDto vd = new EntryValueDto();
                vd.langRef = v.langRef();
                vd.description = v.description();
                vd.value = v.value();
                return vd;
            });
            return ed;
        });
        return dto;
    }

    private static <S, T> List<T> mapAll(List<S> source, Function<S, T> mapper) {
        if (source == null) return List.of();
        List<T> result = new ArrayList<>(source.size());
        for (S s : source) {
            result.add(mapper.apply(s));
        }
        return result;
    }

    private static String require(String value, String attribute) {
        if (value == null) {
            throw EafException.of(EafError.CODEC, "missing attribute " + attribute);
        }
        return value;
    }
}
