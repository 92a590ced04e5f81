package com.toolgate.gateway.config;

import com.toolgate.security.scope.OperationDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * The registered operation catalogue, bound from {@code toolgate.catalog.operations}.
 * Only the scope requirements matter here; handlers live behind the dispatcher.
 */
@ConfigurationProperties(prefix = "toolgate.catalog")
@Validated
public record OperationCatalogProperties(@Valid List<Operation> operations) {

    public OperationCatalogProperties {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /**
     * @param name           operation name as sent in {@code params.name}
     * @param requiredScopes narrow scopes the operation needs
     */
    public record Operation(@NotBlank String name, List<String> requiredScopes) {

        public Operation {
            requiredScopes = requiredScopes == null ? List.of() : List.copyOf(requiredScopes);
        }
    }

    public List<OperationDescriptor> toDescriptors() {
        return operations.stream()
                .map(op -> new OperationDescriptor(op.name(), op.requiredScopes()))
                .toList();
    }
}
