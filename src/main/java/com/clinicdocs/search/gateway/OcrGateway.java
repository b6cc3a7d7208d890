package com.clinicdocs.search.gateway;

import com.clinicdocs.search.model.StorageLocation;

/**
 * Text extraction over stored content. Failures, timeouts included, surface as
 * {@link com.clinicdocs.search.exception.OcrGatewayException}.
 */
public interface OcrGateway {

    OcrResult extractText(StorageLocation blob);
}
