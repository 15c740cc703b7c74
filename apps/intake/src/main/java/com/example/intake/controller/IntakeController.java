package com.example.intake.controller;

import com.example.intake.common.util.StringSanitizer;
import com.example.intake.controller.dto.BatchResponse;
import com.example.intake.pipeline.IngestedFile;
import com.example.intake.pipeline.IngestionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/intake")
@RequiredArgsConstructor
public class IntakeController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final IngestionPipeline pipeline;

    /**
     * Processes the uploaded files as one batch. With an {@code Idempotency-Key} header, file
     * {@code i} is keyed {@code <header>:<i>}, so resubmitting the same batch stores nothing twice.
     */
    @PostMapping(path = "/batches", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<BatchResponse> ingestBatch(
            @RequestPart("files") Flux<FilePart> files,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        if (idempotencyKey != null && !StringSanitizer.isValidSafeId(idempotencyKey)) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid Idempotency-Key header"));
        }
        log.debug("POST /batches - idempotencyKey: {}", StringSanitizer.forLog(idempotencyKey));

        return files.index()
                .concatMap(indexed -> toIngestedFile(indexed.getT2(), fileKey(idempotencyKey, indexed.getT1())))
                .collectList()
                .flatMap(ingested -> ingested.isEmpty()
                        ? Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "No files uploaded"))
                        : pipeline.ingest(ingested))
                .map(BatchResponse::from);
    }

    private Mono<IngestedFile> toIngestedFile(FilePart part, @Nullable String key) {
        MediaType contentType = part.headers().getContentType();
        return DataBufferUtils.join(part.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new IngestedFile(
                        part.filename(),
                        contentType == null ? MediaType.APPLICATION_OCTET_STREAM_VALUE : contentType.toString(),
                        bytes,
                        key));
    }

    @Nullable
    private static String fileKey(@Nullable String idempotencyKey, long index) {
        return idempotencyKey == null ? null : idempotencyKey + ":" + index;
    }
}
