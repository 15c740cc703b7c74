package com.example.intake.extraction;

import com.example.intake.client.WebClientFactory;
import com.example.intake.common.util.RetryUtils;
import com.example.intake.common.util.StringSanitizer;
import com.example.intake.config.properties.OcrProperties;
import com.example.intake.exception.ApiException;
import com.example.intake.pipeline.IngestedFile;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Sends the file as multipart {@code file} part to the OCR service and reads back
 * {@code {"text": "...", "confidence": 0.93}}.
 */
@Slf4j
@Component
public class RemoteOcrTextExtractor implements TextExtractor {

    private static final String SERVICE_NAME = "OcrService";

    private final WebClient webClient;
    private final OcrProperties properties;

    @Autowired
    public RemoteOcrTextExtractor(WebClientFactory webClientFactory, OcrProperties properties) {
        this(webClientFactory.ocrClient(), properties);
    }

    RemoteOcrTextExtractor(WebClient webClient, OcrProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    @NonNull
    public Mono<ExtractionResult> extract(@NonNull IngestedFile file) {
        log.debug("Requesting OCR for file {} ({} bytes)", StringSanitizer.forLog(file.fileName()), file.sizeBytes());

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new NamedByteArrayResource(file.content(), file.fileName()))
                .contentType(MediaType.parseMediaType(file.contentType()));

        return webClient.post()
                .uri(properties.extractPath())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(),
                        response -> ApiException.fromResponse(SERVICE_NAME, "OCR request failed", response))
                .bodyToMono(OcrResponse.class)
                .timeout(properties.timeout())
                .retryWhen(RetryUtils.backoff(properties.retry(), "OCR"))
                .map(response -> new ExtractionResult(response.text(), clamp(response.confidence())));
    }

    private static double clamp(Double confidence) {
        if (confidence == null) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OcrResponse(String text, Double confidence) {}

    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String fileName;

        NamedByteArrayResource(byte[] content, String fileName) {
            super(content);
            this.fileName = fileName;
        }

        @Override
        public String getFilename() {
            return fileName;
        }
    }
}
