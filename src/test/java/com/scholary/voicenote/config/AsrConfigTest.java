package com.scholary.voicenote.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.voicenote.PipelineFixtures;
import com.scholary.voicenote.asr.AsrProperties;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

class AsrConfigTest {

  @Test
  void defaults_shouldKeepCallTimeoutBelowBackoffCeiling() throws Exception {
    List<PropertySource<?>> sources =
        new YamlPropertySourceLoader()
            .load("application", new ClassPathResource("application.yml"));
    Binder binder = new Binder(ConfigurationPropertySources.from(sources));

    AsrProperties asr = binder.bind("asr", AsrProperties.class).get();
    PipelineProperties pipeline = binder.bind("pipeline", PipelineProperties.class).get();

    assertThat(asr.callTimeout()).isLessThan(pipeline.backoffMax());
    assertThatCode(() -> new AsrConfig(asr, pipeline)).doesNotThrowAnyException();
  }

  @Test
  void constructor_shouldRejectCallTimeoutNotBelowBackoffCeiling() {
    PipelineProperties pipeline = PipelineFixtures.pipelineProperties(Path.of("/tmp/scratch"));

    assertThatThrownBy(() -> new AsrConfig(asr(Duration.ofSeconds(30)), pipeline))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("asr.call-timeout");
    assertThatThrownBy(() -> new AsrConfig(asr(Duration.ofSeconds(120)), pipeline))
        .isInstanceOf(IllegalStateException.class);
  }

  private static AsrProperties asr(Duration callTimeout) {
    return new AsrProperties(
        "https://api.openai.com/v1", "key", "whisper-1", "fa", Duration.ofSeconds(10), callTimeout);
  }
}
