package io.crisisintel.coordination.config;

import io.crisisintel.coordination.security.CallerContextArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  private final CallerContextArgumentResolver callerContextArgumentResolver;

  public WebMvcConfig(CallerContextArgumentResolver callerContextArgumentResolver) {
    this.callerContextArgumentResolver = callerContextArgumentResolver;
  }

  @Override
  public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
    resolvers.add(callerContextArgumentResolver);
  }
}
