package wiretx.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import wiretx.TransactionConfig;
import wiretx.WireConnection;
import wiretx.jdbc.JdbcStatusProbe;
import wiretx.jdbc.JdbcWireConnectionFactory;
import wiretx.jdbc.PgJdbcStatusProbe;
import wiretx.spi.MetricsExporter;

import javax.sql.DataSource;

/**
 * Auto-configuration for wiretx.
 *
 * <p>Exposes a {@link TransactionConfig} built from {@link WiretxProperties} and, when a
 * {@link DataSource} is present, a {@link JdbcWireConnectionFactory} opening
 * {@link WireConnection}s on it. A {@link MetricsExporter} bean, if any, is passed on to every
 * connection.
 *
 * @see WiretxProperties
 * @see WiretxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(WireConnection.class)
@EnableConfigurationProperties(WiretxProperties.class)
public class WiretxAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public TransactionConfig wiretxTransactionConfig(WiretxProperties props) {
    return props.toTransactionConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public JdbcStatusProbe wiretxStatusProbe() {
    return PgJdbcStatusProbe.INSTANCE;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(DataSource.class)
  public JdbcWireConnectionFactory wireConnectionFactory(DataSource dataSource,
      TransactionConfig config, JdbcStatusProbe statusProbe,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    return new JdbcWireConnectionFactory(dataSource, config, statusProbe, metrics);
  }
}
