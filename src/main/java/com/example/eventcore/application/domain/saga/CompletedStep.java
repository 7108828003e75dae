package com.example.eventcore.application.domain.saga;

import java.util.Map;

import com.example.eventcore.application.domain.saga.vo.CompensationState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已成功的正向步驟，保存補償所需的輸入
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletedStep {

	private int stepIndex;

	private String stepName;

	private Map<String, Object> result;

	private Map<String, Object> compensationInput;

	private CompensationState compensationState;
}
