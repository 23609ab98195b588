package com.skyqa.locus;

import static org.assertj.core.api.Assertions.assertThat;

import com.skyqa.locus.config.DiagnosticsProperties;
import com.skyqa.locus.dto.LocusDefinition;
import com.skyqa.locus.dto.LocusFitStrategy;
import com.skyqa.locus.service.LocusDiagnosticsService;
import com.skyqa.locus.service.QuantityStatisticsService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/** Starts the application context with the packaged application.yml. */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class StellarLocusDiagnosticsApplicationTest {

  @Autowired private DiagnosticsProperties properties;

  @Autowired private LocusDiagnosticsService locusDiagnosticsService;

  @Autowired private QuantityStatisticsService quantityStatisticsService;

  @Test
  void applicationContextLoads() {
    assertThat(locusDiagnosticsService).isNotNull();
    assertThat(quantityStatisticsService).isNotNull();
  }

  @Test
  void shouldBindPackagedLoci() {
    List<LocusDefinition> loci = properties.locusDefinitions();

    assertThat(loci)
        .extracting(LocusDefinition::name)
        .containsExactly("gri", "wFit", "xFit", "yFit", "riz", "izy", "z9y");
    assertThat(loci.get(2).strategy()).isEqualTo(LocusFitStrategy.VERTICAL);
    assertThat(loci.get(0).degree()).isEqualTo(3);
    assertThat(properties.magThreshold()).isEqualTo(22.0);
    assertThat(properties.badFlags()).hasSize(4);
  }
}
