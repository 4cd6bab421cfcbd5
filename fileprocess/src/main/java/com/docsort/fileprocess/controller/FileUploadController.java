package com.docsort.fileprocess.controller;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.docsort.classify.KeywordTable;
import com.docsort.filing.FilenameNormalizer;
import com.docsort.filing.FilingService;
import com.docsort.fileprocess.config.DocsortProperties;
import com.docsort.model.ClassificationOutcome;
import com.docsort.pipeline.DocumentPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*") // Allow requests from the HTML file if running separately
public class FileUploadController {

    private static final Logger log = LoggerFactory.getLogger(FileUploadController.class);

    /** JSON body for a classified upload. */
    public record UploadResult(String fileName, String category, String identifier, String storedAs) {}

    /** One row of the keyword table. */
    public record CategoryKeywords(String category, List<String> keywords) {}

    private final DocumentPipeline pipeline;
    private final FilingService filing;
    private final KeywordTable keywordTable;
    private final Path inboxDir;

    public FileUploadController(DocumentPipeline pipeline, FilingService filing,
                                KeywordTable keywordTable, DocsortProperties properties) {
        this.pipeline = pipeline;
        this.filing = filing;
        this.keywordTable = keywordTable;
        this.inboxDir = Path.of(properties.getInboxDir());
    }

    @PostMapping("/upload")
    public ResponseEntity<?> uploadFile(@RequestParam("file") MultipartFile file) {

        // 1. Check if the file is empty
        if (file.isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("Please select a file to upload.");
        }

        String fileName = safeName(file.getOriginalFilename());
        Path staging = null;
        Path saved = null;
        try {
            // 2. Stage the upload in its own folder so concurrent uploads never collide
            Files.createDirectories(inboxDir);
            staging = Files.createTempDirectory(inboxDir, "upload-");
            saved = staging.resolve(fileName);
            file.transferTo(saved);

            // 3. Classify and move it under its category folder
            ClassificationOutcome outcome = pipeline.process(saved);
            Path stored = filing.file(saved, outcome);
            String identifier = outcome.hasIdentifier() ? outcome.identifier().digits() : null;
            log.info("Upload {} → {}{}", fileName, outcome.category(),
                    identifier == null ? "" : " (NEW NAME: " + stored.getFileName() + ")");

            return ResponseEntity.ok(new UploadResult(
                    fileName, outcome.category().folderName(), identifier, stored.toString()));

        } catch (IOException | RuntimeException e) {
            log.error("Could not process upload {}", fileName, e);
            moveToErrors(saved);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Could not upload the file: " + e.getMessage());
        } finally {
            deleteStaging(staging);
        }
    }

    @GetMapping("/categories")
    public List<CategoryKeywords> categories() {
        return keywordTable.entries().stream()
                .map(e -> new CategoryKeywords(e.category().folderName(), e.keywords()))
                .toList();
    }

    // Keeps only the last path segment of the client's name.
    static String safeName(String originalFilename) {
        String cleaned = StringUtils.getFilename(StringUtils.cleanPath(
                originalFilename == null ? "" : originalFilename.replace('\\', '/')));
        if (cleaned == null || cleaned.isBlank() || cleaned.equals("..")) {
            return "upload";
        }
        return FilenameNormalizer.normalize(cleaned);
    }

    // The staged copy is the only one left; keep it before the staging folder goes.
    private void moveToErrors(Path saved) {
        if (saved == null || !Files.exists(saved)) return;
        try {
            Path kept = filing.fileAsError(saved);
            log.warn("Upload kept in {}", kept);
        } catch (IOException e) {
            log.error("Could not move {} to the error folder", saved, e);
        }
    }

    private static void deleteStaging(Path staging) {
        if (staging == null) return;
        try {
            FileSystemUtils.deleteRecursively(staging);
        } catch (IOException e) {
            log.warn("Could not remove staging folder {}", staging, e);
        }
    }
}
