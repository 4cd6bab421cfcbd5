package com.docsort.fileprocess.config;

import com.docsort.classify.KeywordTable;
import com.docsort.filing.FilingService;
import com.docsort.pipeline.DocumentPipeline;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

@Configuration
public class PipelineConfig {

    @Bean(destroyMethod = "close")
    public DocumentPipeline documentPipeline(DocsortProperties properties) throws IOException {
        return DocumentPipeline.create(properties.toSettings());
    }

    @Bean
    public FilingService filingService(DocsortProperties properties) throws IOException {
        FilingService filing = new FilingService(Path.of(properties.getUploadDir()));
        filing.setupDirectories();
        return filing;
    }

    @Bean
    public KeywordTable keywordTable(DocsortProperties properties) throws IOException {
        return properties.getKeywordTable().isBlank()
                ? KeywordTable.loadDefault()
                : KeywordTable.load(Path.of(properties.getKeywordTable()));
    }
}
