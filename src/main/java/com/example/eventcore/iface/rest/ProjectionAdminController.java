package com.example.eventcore.iface.rest;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.eventcore.application.projection.ProjectionHandler;
import com.example.eventcore.application.projection.ProjectionManager;
import com.example.eventcore.application.projection.ProjectionStatus;

import lombok.RequiredArgsConstructor;

/**
 * 投影監控與重建
 */
@RestController
@RequestMapping("/projections")
@RequiredArgsConstructor
public class ProjectionAdminController {

	private final ProjectionManager projectionManager;
	private final List<ProjectionHandler> handlers;

	@GetMapping
	public ResponseEntity<List<ProjectionStatus>> statuses() {
		return ResponseEntity.ok(projectionManager.statuses());
	}

	/**
	 * 清空讀取模型並從全域位置 0 重新套用
	 */
	@PostMapping("/{name}/rebuild")
	public ResponseEntity<Map<String, Object>> rebuild(@PathVariable String name) {
		ProjectionHandler handler = handlers.stream().filter(h -> h.projectionName().equals(name)).findFirst()
				.orElseThrow(() -> new IllegalArgumentException("未註冊的投影: " + name));
		int replayed = projectionManager.rebuild(name, handler);
		return ResponseEntity.ok(Map.of("projectionName", name, "replayed", replayed));
	}
}
