package com.clinicdocs.search.gateway;

import com.clinicdocs.search.exception.OcrGatewayException;
import com.clinicdocs.search.exception.StorageGatewayException;
import com.clinicdocs.search.infra.RateLimiter;
import com.clinicdocs.search.model.StorageLocation;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Extracts text with Apache Tika. Scanned images go through Tika's Tesseract parser when a
 * tesseract binary is installed; PDFs with a text layer are read directly.
 */
@Slf4j
@Component
public class TikaOcrGateway implements OcrGateway {

    private final StorageGateway storageGateway;
    private final RateLimiter ocrLimiter;
    private final int maxTextLength;
    private final AutoDetectParser parser = new AutoDetectParser();

    public TikaOcrGateway(StorageGateway storageGateway,
                          @Qualifier("ocrLimiter") RateLimiter ocrLimiter,
                          @Value("${app.ocr.max-text-length:-1}") int maxTextLength) {
        this.storageGateway = storageGateway;
        this.ocrLimiter = ocrLimiter;
        this.maxTextLength = maxTextLength;
    }

    @Override
    public OcrResult extractText(StorageLocation blob) {
        byte[] content = read(blob);
        ocrLimiter.acquire(blob.containerName(), Math.max(1, content.length / 1024));

        long started = System.nanoTime();
        Metadata metadata = new Metadata();
        BodyContentHandler handler = new BodyContentHandler(-1);
        try (TikaInputStream stream = TikaInputStream.get(content)) {
            parser.parse(stream, handler, metadata, new ParseContext());
        } catch (IOException | SAXException | TikaException e) {
            throw new OcrGatewayException("Text extraction failed for " + blob.blobName() + ": " + e.getMessage(), e);
        }
        double seconds = (System.nanoTime() - started) / 1_000_000_000.0;

        String text = handler.toString().strip();
        if (text.isEmpty()) {
            throw new OcrGatewayException("No text could be extracted from " + blob.blobName());
        }
        if (maxTextLength > 0 && text.length() > maxTextLength) {
            text = text.substring(0, maxTextLength);
        }

        Integer pages = metadata.getInt(PagedText.N_PAGES);
        log.debug("Extracted {} chars from {} in {}s", text.length(), blob.blobName(), seconds);
        return new OcrResult(text, pages == null ? 1 : pages, seconds);
    }

    private byte[] read(StorageLocation blob) {
        try (InputStream in = storageGateway.open(blob.blobName())) {
            return in.readAllBytes();
        } catch (IOException | StorageGatewayException e) {
            throw new OcrGatewayException("Could not read stored content of " + blob.blobName(), e);
        }
    }
}
