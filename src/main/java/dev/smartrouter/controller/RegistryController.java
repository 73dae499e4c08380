package dev.smartrouter.controller;

import dev.smartrouter.dto.response.RegistryView;
import dev.smartrouter.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/registry")
public class RegistryController {
    private static final Logger log = LoggerFactory.getLogger(RegistryController.class);
    private final ModelRegistry registry;
    public RegistryController(ModelRegistry registry) { this.registry = registry; }

    @GetMapping
    public ResponseEntity<RegistryView> current() {
        return ResponseEntity.ok(RegistryView.of(registry.current()));
    }

    /** Manual reload: re-reads settings and the backend model listing. */
    @PostMapping("/reload")
    public ResponseEntity<RegistryView> reload() {
        log.info("Manual registry reload requested");
        return ResponseEntity.ok(RegistryView.of(registry.reload()));
    }
}
