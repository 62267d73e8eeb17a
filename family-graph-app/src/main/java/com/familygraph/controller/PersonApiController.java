package com.familygraph.controller;

import com.familygraph.model.Person;
import com.familygraph.service.PersonService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/persons")
public class PersonApiController {

    private final PersonService personService;

    public PersonApiController(PersonService personService) {
        this.personService = personService;
    }

    @PostMapping
    public ResponseEntity<Person> createPerson(@RequestBody Map<String, Object> body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(personService.createPerson(body));
    }

    @GetMapping
    public List<Person> listPersons() {
        return personService.listPersons();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Person> getPerson(@PathVariable String id) {
        return personService.getPerson(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public ResponseEntity<Person> updatePerson(@PathVariable String id, @RequestBody Map<String, Object> body) {
        return personService.updatePerson(id, body)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/{id}/position")
    public ResponseEntity<Person> updatePosition(@PathVariable String id, @RequestBody PositionUpdate position) {
        return personService.updatePosition(id, position.x(), position.y())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/positions")
    public Map<String, Object> updatePositions(@RequestBody List<Map<String, Object>> positions) {
        int count = personService.updatePositions(positions);
        return Map.of("status", "success", "updatedCount", count);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deletePerson(@PathVariable String id) {
        if (!personService.deletePerson(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "id", id));
    }

    public record PositionUpdate(double x, double y) {}
}
