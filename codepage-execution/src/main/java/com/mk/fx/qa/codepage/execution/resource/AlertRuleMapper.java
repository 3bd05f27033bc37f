package com.mk.fx.qa.codepage.execution.resource;

import com.mk.fx.qa.codepage.execution.dto.AlertRuleRequest;
import com.mk.fx.qa.codepage.execution.dto.AlertRuleUpdateRequest;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertCondition;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertRuleDefinition;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertRuleType;
import com.mk.fx.qa.codepage.execution.monitoring.alert.AlertRuleUpdate;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface AlertRuleMapper {

  @Mapping(target = "type", source = "type", qualifiedByName = "mapRuleType")
  @Mapping(target = "condition", source = "condition", qualifiedByName = "mapCondition")
  AlertRuleDefinition toDefinition(AlertRuleRequest request);

  @Mapping(target = "type", source = "type", qualifiedByName = "mapRuleType")
  @Mapping(target = "condition", source = "condition", qualifiedByName = "mapCondition")
  AlertRuleUpdate toUpdate(AlertRuleUpdateRequest request);

  @Named("mapRuleType")
  default AlertRuleType mapRuleType(String type) {
    return type == null ? null : AlertRuleType.fromValue(type);
  }

  @Named("mapCondition")
  default AlertCondition mapCondition(String condition) {
    return condition == null ? null : AlertCondition.fromValue(condition);
  }
}
