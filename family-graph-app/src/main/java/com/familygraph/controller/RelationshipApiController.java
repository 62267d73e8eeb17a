package com.familygraph.controller;

import com.familygraph.model.Marriage;
import com.familygraph.model.ParentChild;
import com.familygraph.service.RelationshipService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class RelationshipApiController {

    private final RelationshipService relationshipService;

    public RelationshipApiController(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    // ========== MARRIAGES ==========

    @PostMapping("/marriages")
    public ResponseEntity<Marriage> createMarriage(@RequestBody MarriageRequest request) {
        Marriage marriage = relationshipService.createMarriage(
                request.spouse1Id(), request.spouse2Id(), request.marriageDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(marriage);
    }

    @GetMapping("/marriages")
    public List<Marriage> listMarriages() {
        return relationshipService.listMarriages();
    }

    @DeleteMapping("/marriages/{id}")
    public Map<String, Object> deleteMarriage(@PathVariable String id) {
        relationshipService.deleteMarriage(id);
        return Map.of("status", "deleted", "id", id);
    }

    // ========== PARENT-CHILD ==========

    @PostMapping("/children")
    public ResponseEntity<ParentChild> addChild(@RequestBody ParentChild request) {
        ParentChild relation = relationshipService.addChild(
                request.parentId(), request.childId(), request.marriageId());
        return ResponseEntity.status(HttpStatus.CREATED).body(relation);
    }

    @GetMapping("/children")
    public List<ParentChild> listParentChild() {
        return relationshipService.listParentChild();
    }

    @DeleteMapping("/children/{parentId}/{childId}")
    public Map<String, Object> removeChild(@PathVariable String parentId, @PathVariable String childId) {
        relationshipService.removeChild(parentId, childId);
        return Map.of("status", "deleted", "parentId", parentId, "childId", childId);
    }

    public record MarriageRequest(String spouse1Id, String spouse2Id, String marriageDate) {}
}
