package com.reviewgate.spring;

import com.reviewgate.adapter.spring.ReviewGateAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the review gate in a Spring Boot application.
 * 
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableReviewGate
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ReviewGateAutoConfiguration.class)
public @interface EnableReviewGate {
}
