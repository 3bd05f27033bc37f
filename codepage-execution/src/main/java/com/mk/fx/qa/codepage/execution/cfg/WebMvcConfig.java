package com.mk.fx.qa.codepage.execution.cfg;

import com.mk.fx.qa.codepage.execution.monitoring.ApiResponseMetricsInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final ApiResponseMetricsInterceptor apiResponseMetricsInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(apiResponseMetricsInterceptor).addPathPatterns("/api/**");
  }
}
