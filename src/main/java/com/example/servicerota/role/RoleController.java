package com.example.servicerota.role;

import com.example.servicerota.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/roles")
public class RoleController {

    private final RoleDefinitions roleDefinitions;

    public RoleController(RoleDefinitions roleDefinitions) {
        this.roleDefinitions = roleDefinitions;
    }

    @GetMapping("")
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> listRoles() {
        List<Map<String, Object>> data = new ArrayList<>();
        int priority = 1;
        for (RoleDefinition role : roleDefinitions.inPriorityOrder()) {
            Map<String, Object> m = new HashMap<>();
            m.put("priority", priority++);
            m.put("name", role.name());
            m.put("poolKey", role.poolKey());
            m.put("exclusiveWith", List.copyOf(role.exclusiveWith()));
            data.add(m);
        }
        return ResponseEntity.ok(ApiResponse.success("roles", data));
    }
}
