package xyz.firestige.pipeline.validation.validator;

import org.junit.jupiter.api.Test;
import xyz.firestige.pipeline.domain.definition.ParameterDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineDefinition;
import xyz.firestige.pipeline.domain.definition.PipelineOptions;
import xyz.firestige.pipeline.domain.definition.StageDefinition;
import xyz.firestige.pipeline.domain.definition.StepDefinition;
import xyz.firestige.pipeline.validation.ValidationError;
import xyz.firestige.pipeline.validation.ValidationResult;

import java.time.Duration;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineOptionsValidatorTest {

    private final PipelineOptionsValidator validator = new PipelineOptionsValidator();

    private static PipelineDefinition.Builder base() {
        return PipelineDefinition.builder("app")
                .stage(StageDefinition.builder("build").step(StepDefinition.builder("go").command("true").build()).build());
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(base().build()).isValid()).isTrue();
    }

    @Test
    void rejectsOutOfRangeOptions() {
        PipelineDefinition definition = base()
                .options(new PipelineOptions(0, 0, Duration.ofSeconds(-1), Duration.ZERO, null))
                .build();

        ValidationResult result = validator.validate(definition);

        assertThat(result.getErrors().stream().map(ValidationError::getField).collect(Collectors.toList()))
                .containsExactly("options.concurrencyLimit", "options.retention",
                        "options.timeout", "options.defaultStepTimeout");
    }

    @Test
    void rejectsDurationsBeyondNanosecondRange() {
        PipelineDefinition definition = base()
                .options(new PipelineOptions(null, null, Duration.ofHours(3_000_000), Duration.ofSeconds(Long.MAX_VALUE), null))
                .build();

        ValidationResult result = validator.validate(definition);

        assertThat(result.getErrors()).extracting(ValidationError::getField)
                .containsExactly("options.timeout", "options.defaultStepTimeout");
        assertThat(result.getErrors()).extracting(ValidationError::getErrorCode)
                .containsOnly(ValidationError.INVALID_DURATION);
    }

    @Test
    void rejectsDuplicateParameters() {
        PipelineDefinition definition = base()
                .parameter(ParameterDefinition.of("ENV", "dev"))
                .parameter(ParameterDefinition.of("ENV", "prod"))
                .build();

        ValidationResult result = validator.validate(definition);

        assertThat(result.getErrors()).extracting(ValidationError::getErrorCode)
                .containsExactly(ValidationError.DUPLICATE_PARAMETER);
    }
}
