package com.courseportal.catalog;

import com.courseportal.common.exception.CatalogParseException;
import com.courseportal.common.exception.CatalogStorageException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Course catalog persisted as a JSON array in a single file.
 *
 * Every append reads the whole file, adds the course at the end and rewrites the
 * whole file. A missing file is an empty catalog. The read-modify-write cycle is
 * serialized per repository instance so concurrent appends cannot overwrite each
 * other; it is not atomic against a crash mid-write.
 */
@Repository
@Slf4j
public class CourseCatalogRepository {

    private static final TypeReference<List<Course>> CATALOG_TYPE = new TypeReference<>() {};

    private final Path catalogFile;
    private final ObjectMapper objectMapper;
    private final ObjectWriter catalogWriter;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CourseCatalogRepository(
            @Value("${course-portal.catalog.file:course_catalog.json}") String catalogFile,
            ObjectMapper objectMapper) {
        this.catalogFile = Path.of(catalogFile);
        this.objectMapper = objectMapper;
        this.catalogWriter = objectMapper.writer(new CatalogPrettyPrinter());

        log.info("Course catalog backed by {}", this.catalogFile.toAbsolutePath());
    }

    /**
     * Load the full catalog in insertion order.
     *
     * @return all courses, or an empty list if the catalog file does not exist yet
     * @throws CatalogParseException if the file is not a JSON array of courses
     * @throws CatalogStorageException if the file cannot be read
     */
    public List<Course> load() {
        lock.readLock().lock();
        try {
            return readCatalog();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Append a course to the end of the catalog and rewrite the file.
     * The file and its parent directories are created on first append.
     *
     * @param course the course to store, stored as given
     * @throws CatalogParseException if the existing file is not a JSON array of courses
     * @throws CatalogStorageException if the file cannot be read or written
     */
    public void append(Course course) {
        lock.writeLock().lock();
        try {
            List<Course> courses = readCatalog();
            courses.add(course);
            writeCatalog(courses);

            log.debug("Appended course {} to {} ({} courses)", course.getCode(), catalogFile, courses.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Path getCatalogFile() {
        return catalogFile;
    }

    private List<Course> readCatalog() {
        if (!Files.exists(catalogFile)) {
            log.debug("Catalog file {} does not exist, treating as empty", catalogFile);
            return new ArrayList<>();
        }

        try (InputStream in = Files.newInputStream(catalogFile)) {
            List<Course> courses = objectMapper.readValue(in, CATALOG_TYPE);
            if (courses == null) {
                return new ArrayList<>();
            }
            // null entries carry no course
            return courses.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
        } catch (JsonProcessingException e) {
            throw new CatalogParseException(catalogFile, e);
        } catch (IOException e) {
            throw new CatalogStorageException("Failed to read catalog file " + catalogFile,
                catalogFile, "load", e);
        }
    }

    private void writeCatalog(List<Course> courses) {
        try {
            Path parent = catalogFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(catalogFile)) {
                catalogWriter.writeValue(out, courses);
            }
        } catch (IOException e) {
            throw new CatalogStorageException("Failed to write catalog file " + catalogFile,
                catalogFile, "append", e);
        }
    }

    /**
     * Four-space indentation for arrays and objects, {@code "key": value} separators.
     */
    static final class CatalogPrettyPrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("    ", "\n");

        CatalogPrettyPrinter() {
            indentArraysWith(INDENTER);
            indentObjectsWith(INDENTER);
        }

        CatalogPrettyPrinter(CatalogPrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new CatalogPrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(_separators.getObjectFieldValueSeparator());
            g.writeRaw(' ');
        }
    }
}
