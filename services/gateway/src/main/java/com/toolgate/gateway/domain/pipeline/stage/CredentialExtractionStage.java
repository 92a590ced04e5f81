package com.toolgate.gateway.domain.pipeline.stage;

import com.toolgate.gateway.domain.discovery.ResourceMetadataUrls;
import com.toolgate.gateway.domain.pipeline.AuthorizationStage;
import com.toolgate.gateway.domain.pipeline.DenialResponse;
import com.toolgate.gateway.domain.pipeline.InboundRequest;
import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.pipeline.StageOutcome;
import com.toolgate.security.Credential;
import com.toolgate.security.CredentialClassifier;
import com.toolgate.security.CredentialException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 1: classifies the {@code Authorization} header.
 *
 * <p>A missing credential gets a 401 pointing at the discovery document for the resolved
 * resource path; a malformed one or an unsupported scheme gets a 400.
 */
public class CredentialExtractionStage implements AuthorizationStage {

    private static final Logger log = LoggerFactory.getLogger(CredentialExtractionStage.class);

    public static final String AUTHORIZATION = "Authorization";

    private final ResourceMetadataUrls metadataUrls;

    public CredentialExtractionStage(ResourceMetadataUrls metadataUrls) {
        this.metadataUrls = metadataUrls;
    }

    @Override
    public String name() {
        return "credential";
    }

    @Override
    public StageOutcome process(InboundRequest request, RequestContext context) {
        Credential credential;
        try {
            credential = CredentialClassifier.classify(request.header(AUTHORIZATION));
        } catch (CredentialException e) {
            if (e.reason() == CredentialException.Reason.MISSING_CREDENTIAL) {
                String metadataUrl = metadataUrls.metadataUrl(request,
                        metadataUrls.resolveResourcePath(request.path()));
                return StageOutcome.terminate(DenialResponse.unauthorized(metadataUrl));
            }
            log.debug("Rejecting credential: {}", e.reason());
            return StageOutcome.terminate(DenialResponse.badRequest(e.getMessage()));
        }
        log.debug("Classified credential as {}", credential.type());
        context.attachCredential(credential);
        return StageOutcome.forward();
    }
}
