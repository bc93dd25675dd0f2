package wiretx.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import wiretx.micrometer.MicrometerMetricsExporter;
import wiretx.spi.MetricsExporter;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} exists and {@code wiretx.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link WiretxAutoConfiguration} so the exporter reaches the connection factory.
 */
@AutoConfiguration(before = WiretxAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "wiretx.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(WiretxProperties.class)
public class WiretxMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  @ConditionalOnBean(MeterRegistry.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, WiretxProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
