package com.example.styleverify.config;

import com.example.styleverify.comparator.ComparedStyle;
import com.example.styleverify.comparator.DirectFormatComparator;
import com.example.styleverify.comparator.SignatureComparator;
import com.example.styleverify.comparator.StyleComparator;
import com.example.styleverify.model.*;
import com.example.styleverify.service.MismatchAggregator;
import com.example.styleverify.service.SeverityPolicy;
import com.example.styleverify.service.StyleSignatureBuilder;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.example.styleverify.TestStyles.NOW;
import static com.example.styleverify.TestStyles.context;
import static com.example.styleverify.TestStyles.style;
import static com.example.styleverify.TestStyles.template;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MongoConfig")
class MongoConfigTest {

    private final StyleSignatureBuilder signatures = new StyleSignatureBuilder();
    private MappingMongoConverter converter;

    @BeforeEach
    void setUp() {
        MongoCustomConversions conversions = new MongoCustomConversions(List.of());
        MongoMappingContext mappingContext = new MongoMappingContext();
        mappingContext.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
        mappingContext.afterPropertiesSet();
        converter = MongoConfig.mappingMongoConverter(NoOpDbRefResolver.INSTANCE, mappingContext, conversions);
        converter.afterPropertiesSet();
    }

    private VerificationResult completedRunWithDirectFormatMismatch() {
        TextStyle body = style(1, "Normal")
                .pattern(new DirectFormatPattern("BoldLeadIn", "Run:0", Map.of("bold", "true")))
                .build();
        ExtractedContext document = context("p1").styleName("Normal")
                .property("fontFamily", "Calibri")
                .property("fontSize", "11")
                .property("color", "#000000")
                .property("styleType", "paragraph")
                .property("w14.glow", "accent1")
                .build();

        ComparedStyle expected = ComparedStyle.of(body, signatures);
        ComparedStyle actual = ComparedStyle.of(document, signatures);
        List<Discrepancy> discrepancies = new ArrayList<>();
        for (StyleComparator comparator : List.of(new SignatureComparator(), new DirectFormatComparator(signatures))) {
            discrepancies.add(new Discrepancy("p1", document.describeLocation(), "Body", "Normal",
                    comparator.category(), comparator.compare(expected, actual), null));
        }
        List<Mismatch> mismatches = new MismatchAggregator(new SeverityPolicy(StyleVerifyProperties.defaults()))
                .aggregate(discrepancies, NOW);

        return VerificationResult.pending(template(body), "candidate.docx", "bob", NOW)
                .transitionTo(VerificationStatus.RUNNING)
                .completed(mismatches, List.of(), new PipelineTimings(0.1, 0.2, 0.3));
    }

    @Test
    @DisplayName("verification result with dotted and direct-format field names is stored and read back")
    void storesMismatchFieldMaps() {
        VerificationResult result = completedRunWithDirectFormatMismatch();
        assertThat(result.mismatches()).extracting(Mismatch::mismatchFields)
                .containsExactlyInAnyOrder("w14.glow", "directFormat:BoldLeadIn");

        Document stored = new Document();
        converter.write(result, stored);

        for (Document mismatch : stored.getList("mismatches", Document.class)) {
            assertThat(mismatch.get("expected", Document.class).keySet()).noneMatch(key -> key.contains("."));
            assertThat(mismatch.get("actual", Document.class).keySet()).noneMatch(key -> key.contains("."));
        }

        VerificationResult read = converter.read(VerificationResult.class, stored);

        assertThat(read.status()).isEqualTo(VerificationStatus.COMPLETED);
        assertThat(read.totalMismatches()).isEqualTo(2);
        assertThat(read.mismatches()).anySatisfy(m ->
                assertThat(m.actual()).containsEntry("w14.glow", "accent1"));
        assertThat(read.mismatches()).anySatisfy(m -> {
            assertThat(m.expected()).containsEntry("directFormat:BoldLeadIn", "bold=true");
            assertThat(m.actual()).containsEntry("directFormat:BoldLeadIn", "absent");
        });
    }
}
