package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.dto.TransformMode;
import com.example.bpmn_transformer.dto.TransformOptions;
import com.example.bpmn_transformer.dto.TransformResult;
import com.example.bpmn_transformer.model.ProcessDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * One run: read, optionally clear old fragments, fragment or mask, write.
 * The output file is only written after the rewrite completed.
 */
@Service
public class TransformService {

    private static final Logger log = LoggerFactory.getLogger(TransformService.class);

    @Autowired
    private BpmnDocumentService bpmnDocumentService;

    @Autowired
    private CleanupService cleanupService;

    @Autowired
    private FragmentService fragmentService;

    @Autowired
    private MaskService maskService;

    public TransformResult transform(TransformOptions options) {
        log.debug("Transform {}", options);
        ProcessDocument document = bpmnDocumentService.read(options.getInput());
        TransformResult result = apply(document, options);
        bpmnDocumentService.write(document, options.getOutput());
        return result;
    }

    /** Rewrites {@code document} in memory. */
    public TransformResult apply(ProcessDocument document, TransformOptions options) {
        int removed = 0;
        if (options.isClearOld()) {
            removed = cleanupService.clearOldFragments(document);
        }

        int count;
        if (options.getMode() == TransformMode.MASK) {
            count = maskService.maskByPrivacy(document, options.getPrivacy(), options.getPrivacyDirection());
        } else {
            count = fragmentService.fragmentByCoupling(document, options.getThreshold(), options.isIncludeSingletons());
        }
        return new TransformResult(options.getMode(), count, removed, options.getOutput());
    }
}
