package com.mk.fx.qa.codepage.execution.resource;

import com.mk.fx.qa.codepage.execution.dto.ExecutionSubmissionRequest;
import com.mk.fx.qa.codepage.execution.model.ExecutionConfigOverrides;
import com.mk.fx.qa.codepage.execution.model.ExecutionEnvironment;
import com.mk.fx.qa.codepage.execution.model.ExecutionRequest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface ExecutionMapper {

  @Mapping(target = "scriptSource", source = "script")
  @Mapping(target = "overrides", source = "request")
  ExecutionRequest toDomain(ExecutionSubmissionRequest request);

  @Mapping(target = "environment", source = "environment", qualifiedByName = "mapEnvironment")
  ExecutionConfigOverrides toOverrides(ExecutionSubmissionRequest request);

  @Named("mapEnvironment")
  default ExecutionEnvironment mapEnvironment(String environment) {
    return environment == null ? null : ExecutionEnvironment.fromValue(environment);
  }
}
