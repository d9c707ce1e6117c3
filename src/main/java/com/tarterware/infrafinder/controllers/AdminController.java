package com.tarterware.infrafinder.controllers;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tarterware.infrafinder.components.InfrastructureRegistry;
import com.tarterware.infrafinder.models.IngestionReport;

@RestController
@RequestMapping("/api/admin")
public class AdminController
{
    @Autowired
    InfrastructureRegistry registry;

    @GetMapping("/status")
    ResponseEntity<IngestionReport> getStatus()
    {
        return new ResponseEntity<IngestionReport>(registry.current().getReport(), HttpStatus.OK);
    }

    // Blocks until the new snapshot is in place.
    @PostMapping("/reload")
    ResponseEntity<IngestionReport> reload()
    {
        return new ResponseEntity<IngestionReport>(registry.reload().getReport(), HttpStatus.OK);
    }
}
