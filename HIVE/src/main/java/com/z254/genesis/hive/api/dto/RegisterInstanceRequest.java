package com.z254.genesis.hive.api.dto;

import com.z254.genesis.hive.registry.ServiceInstance;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for registering a worker instance.
 * Presence of id, role and address is checked by the registry so it can report missing-field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterInstanceRequest {

    @Size(max = 128, message = "Instance id must be at most 128 characters")
    @Pattern(regexp = "[A-Za-z0-9._:-]*", message = "Instance id may only contain letters, digits, '.', '_', ':' and '-'")
    private String id;

    @Size(max = 64, message = "Role must be at most 64 characters")
    private String role;

    @Size(max = 512, message = "Address must be at most 512 characters")
    private String address;

    private List<String> capabilities;

    public ServiceInstance toInstance() {
        return ServiceInstance.builder()
                .id(id)
                .role(role)
                .address(address)
                .capabilities(capabilities != null ? new ArrayList<>(capabilities) : new ArrayList<>())
                .build();
    }
}
