package com.familygraph.service;

import com.familygraph.config.FamilyGraphConfig;
import com.familygraph.model.FamilyTree;
import com.familygraph.model.Marriage;
import com.familygraph.model.ParentChild;
import com.familygraph.model.Person;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Saves whole trees as JSON files in the data directory and loads them back.
 */
@Service
public class TreeFileService {

    private static final Logger log = LoggerFactory.getLogger(TreeFileService.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String EXTENSION = ".json";

    private final TreeStateService treeStateService;
    private final ObjectMapper objectMapper;
    private final Path dataDir;

    public TreeFileService(TreeStateService treeStateService,
                           ObjectMapper objectMapper,
                           FamilyGraphConfig config) {
        this.treeStateService = treeStateService;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.dataDir = Path.of(config.getData().getDir());
    }

    /**
     * Write the current tree to {@code filename}, or to a timestamped name if blank.
     *
     * @return the name of the file written
     */
    public String save(String filename) {
        String name = (filename == null || filename.isBlank())
                ? "family_tree_" + LocalDateTime.now().format(FILE_TIMESTAMP) + EXTENSION
                : withExtension(filename.trim());
        Path target = resolve(name);

        try {
            Files.createDirectories(dataDir);
            Path temp = target.resolveSibling(name + ".tmp");
            objectMapper.writeValue(temp.toFile(), treeStateService.snapshot());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save tree to " + target, e);
        }

        log.info("Saved tree to: {}", target);
        return name;
    }

    /**
     * Replace the stored tree with the contents of {@code filename}. The previous tree stays undoable.
     *
     * @throws NoSuchElementException   if the file does not exist
     * @throws IllegalArgumentException if the file is not a valid tree
     */
    @Transactional
    public FamilyTree load(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        Path source = resolve(filename.trim());
        if (!Files.isRegularFile(source)) {
            throw new NoSuchElementException("File not found");
        }

        FamilyTree tree;
        try {
            tree = objectMapper.readValue(source.toFile(), FamilyTree.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source, e);
        }
        validate(tree);

        treeStateService.recordAction("load_tree");
        treeStateService.replace(tree);
        log.info("Loaded tree from: {}", source);
        return tree;
    }

    /**
     * Saved trees, most recently modified first.
     */
    public List<SavedFile> listFiles() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }

        List<SavedFile> files = new ArrayList<>();
        try (Stream<Path> paths = Files.list(dataDir)) {
            for (Path path : paths.filter(p -> p.getFileName().toString().endsWith(EXTENSION)).toList()) {
                BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                files.add(new SavedFile(
                    path.getFileName().toString(),
                    attrs.size(),
                    LocalDateTime.ofInstant(attrs.lastModifiedTime().toInstant(), ZoneId.systemDefault())
                ));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dataDir, e);
        }

        files.sort(Comparator.comparing(SavedFile::modified).reversed());
        return files;
    }

    private String withExtension(String filename) {
        return filename.endsWith(EXTENSION) ? filename : filename + EXTENSION;
    }

    /**
     * Reject trees the store cannot hold: missing ids or names, and relationships
     * naming persons or marriages the file does not contain.
     */
    private void validate(FamilyTree tree) {
        for (Map.Entry<String, Person> entry : tree.persons().entrySet()) {
            Person person = entry.getValue();
            if (person == null || isBlank(person.id()) || !person.id().equals(entry.getKey())) {
                throw invalid("person " + entry.getKey() + " has a missing or mismatched id");
            }
            if (isBlank(person.name())) {
                throw invalid("person " + person.id() + " has no name");
            }
        }
        for (Map.Entry<String, Marriage> entry : tree.marriages().entrySet()) {
            Marriage marriage = entry.getValue();
            if (marriage == null || isBlank(marriage.id()) || !marriage.id().equals(entry.getKey())) {
                throw invalid("marriage " + entry.getKey() + " has a missing or mismatched id");
            }
            if (!contains(tree.persons(), marriage.spouse1Id())
                    || !contains(tree.persons(), marriage.spouse2Id())) {
                throw invalid("marriage " + marriage.id() + " names an unknown spouse");
            }
        }
        for (ParentChild relation : tree.parentChild()) {
            if (!contains(tree.persons(), relation.parentId())
                    || !contains(tree.persons(), relation.childId())) {
                throw invalid("parent-child link " + relation.parentId() + " -> " + relation.childId()
                        + " names an unknown person");
            }
            if (relation.marriageId() != null && !contains(tree.marriages(), relation.marriageId())) {
                throw invalid("parent-child link " + relation.parentId() + " -> " + relation.childId()
                        + " names an unknown marriage");
            }
        }
    }

    private static IllegalArgumentException invalid(String detail) {
        return new IllegalArgumentException("Invalid tree: " + detail);
    }

    private static boolean contains(Map<String, ?> map, String id) {
        return id != null && map.containsKey(id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Path resolve(String filename) {
        if (filename.contains("/") || filename.contains("\\") || filename.contains("..")) {
            throw new IllegalArgumentException("Invalid filename: " + filename);
        }
        return dataDir.resolve(filename);
    }

    public record SavedFile(String filename, long size, LocalDateTime modified) {}
}
