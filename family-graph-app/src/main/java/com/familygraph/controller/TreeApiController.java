package com.familygraph.controller;

import com.familygraph.layout.LayoutDirection;
import com.familygraph.layout.LayoutOptions;
import com.familygraph.layout.Position;
import com.familygraph.service.LayoutService;
import com.familygraph.service.SvgGenerator;
import com.familygraph.service.TreeFileService;
import com.familygraph.service.TreeFileService.SavedFile;
import com.familygraph.service.TreeStateService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-tree operations: save/load, undo/redo, auto-layout and export.
 */
@RestController
@RequestMapping("/api/tree")
public class TreeApiController {

    private static final MediaType SVG_MEDIA_TYPE = MediaType.valueOf("image/svg+xml");

    private final TreeStateService treeStateService;
    private final TreeFileService treeFileService;
    private final LayoutService layoutService;
    private final SvgGenerator svgGenerator;

    public TreeApiController(TreeStateService treeStateService,
                             TreeFileService treeFileService,
                             LayoutService layoutService,
                             SvgGenerator svgGenerator) {
        this.treeStateService = treeStateService;
        this.treeFileService = treeFileService;
        this.layoutService = layoutService;
        this.svgGenerator = svgGenerator;
    }

    @GetMapping
    public Map<String, Object> getTree() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tree", treeStateService.snapshot());
        body.put("canUndo", treeStateService.canUndo());
        body.put("canRedo", treeStateService.canRedo());
        return body;
    }

    @PostMapping("/save")
    public Map<String, Object> saveTree(@RequestParam(required = false) String filename) {
        String saved = treeFileService.save(filename);
        return Map.of("status", "saved", "filename", saved);
    }

    @PostMapping("/load")
    public Map<String, Object> loadTree(@RequestParam String filename) {
        treeFileService.load(filename);
        return Map.of("status", "loaded", "filename", filename);
    }

    @GetMapping("/files")
    public List<SavedFile> listSavedFiles() {
        return treeFileService.listFiles();
    }

    @PostMapping("/new")
    public Map<String, Object> newTree() {
        treeStateService.reset();
        return Map.of("status", "created");
    }

    @PostMapping("/undo")
    public ResponseEntity<Map<String, Object>> undo() {
        if (!treeStateService.undo()) {
            return ResponseEntity.badRequest().body(Map.of("message", "Nothing to undo"));
        }
        return ResponseEntity.ok(historyStatus("undone"));
    }

    @PostMapping("/redo")
    public ResponseEntity<Map<String, Object>> redo() {
        if (!treeStateService.redo()) {
            return ResponseEntity.badRequest().body(Map.of("message", "Nothing to redo"));
        }
        return ResponseEntity.ok(historyStatus("redone"));
    }

    /**
     * Auto-arrange the tree from the given root and store the positions.
     */
    @PostMapping("/layout")
    public Map<String, Object> autoLayout(@RequestBody LayoutRequest request) {
        LayoutOptions options = layoutService.resolveOptions(
                request.rootPersonId(), request.direction(), request.spacingX(), request.spacingY());
        Map<String, Position> positions = layoutService.applyLayout(options);
        return Map.of("status", "layout_applied", "positions", positions);
    }

    /**
     * Compute positions from the given root without changing the stored tree.
     */
    @PostMapping("/layout/preview")
    public Map<String, Position> previewLayout(@RequestBody LayoutRequest request) {
        return layoutService.previewLayout(layoutService.resolveOptions(
                request.rootPersonId(), request.direction(), request.spacingX(), request.spacingY()));
    }

    @GetMapping(value = "/export.svg", produces = "image/svg+xml")
    public ResponseEntity<byte[]> exportSvg() {
        String svg = svgGenerator.generateSvg(treeStateService.snapshot());
        return ResponseEntity.ok()
                .contentType(SVG_MEDIA_TYPE)
                .header("Content-Disposition", "attachment; filename=\"family_tree.svg\"")
                .body(svg.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Object> historyStatus(String status) {
        return Map.of(
                "status", status,
                "canUndo", treeStateService.canUndo(),
                "canRedo", treeStateService.canRedo());
    }

    public record LayoutRequest(String rootPersonId, LayoutDirection direction, Double spacingX, Double spacingY) {}
}
