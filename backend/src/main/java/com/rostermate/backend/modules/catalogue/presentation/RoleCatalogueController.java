package com.rostermate.backend.modules.catalogue.presentation;

import com.rostermate.backend.modules.catalogue.application.RoleCatalogueService;
import com.rostermate.backend.modules.catalogue.presentation.dto.RoleCatalogueResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/roles")
public class RoleCatalogueController {

    private final RoleCatalogueService roleCatalogueService;

    public RoleCatalogueController(RoleCatalogueService roleCatalogueService) {
        this.roleCatalogueService = roleCatalogueService;
    }

    @GetMapping
    public ResponseEntity<RoleCatalogueResponse> getCatalogue() {
        return ResponseEntity.ok(roleCatalogueService.describeCatalogue());
    }
}
