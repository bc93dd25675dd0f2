/**
 * Spring Boot auto-configuration for wiretx: properties under {@code wiretx.*}, a JDBC
 * connection factory and Micrometer metrics.
 */
package wiretx.spring.boot;
