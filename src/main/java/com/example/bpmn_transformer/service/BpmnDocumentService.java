package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.exception.InvalidDocumentException;
import com.example.bpmn_transformer.model.CouplingSchema;
import com.example.bpmn_transformer.model.ProcessDocument;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.Definitions;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnDiagram;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnPlane;
import org.camunda.bpm.model.xml.ModelException;
import org.camunda.bpm.model.xml.instance.DomElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Loads and stores BPMN documents. Everything else works on the
 * {@link ProcessDocument} this service hands out.
 */
@Service
public class BpmnDocumentService {

    private static final Logger log = LoggerFactory.getLogger(BpmnDocumentService.class);

    public ProcessDocument read(Path input) {
        try (InputStream in = Files.newInputStream(input)) {
            return read(in, input.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + input, e);
        }
    }

    public ProcessDocument read(InputStream in, String sourceName) {
        BpmnModelInstance model;
        try {
            model = Bpmn.readModelFromStream(in);
        } catch (ModelException e) {
            throw new InvalidDocumentException("Not a readable BPMN document: " + sourceName + " (" + e.getMessage() + ")", e);
        }
        return open(model);
    }

    /**
     * Locates the definitions, the first process and an existing diagram plane.
     * Fails before touching the model when there is no process.
     */
    public ProcessDocument open(BpmnModelInstance model) {
        Definitions definitions = model.getDefinitions();
        if (definitions == null) throw new InvalidDocumentException("No bpmn:definitions found");

        Collection<Process> processes = definitions.getChildElementsByType(Process.class);
        if (processes.isEmpty()) throw new InvalidDocumentException("No bpmn:process found");
        Process process = processes.iterator().next();

        BpmnPlane plane = null;
        for (BpmnDiagram diagram : definitions.getChildElementsByType(BpmnDiagram.class)) {
            if (diagram.getBpmnPlane() != null) {
                plane = diagram.getBpmnPlane();
                break;
            }
        }

        DomElement root = definitions.getDomElement();
        if (root.lookupPrefix(CouplingSchema.NAMESPACE) == null) {
            root.registerNamespace(CouplingSchema.PREFIX, CouplingSchema.NAMESPACE);
        }

        log.debug("Opened process '{}' (diagram plane present: {})", process.getId(), plane != null);
        return new ProcessDocument(model, definitions, process, plane);
    }

    public String toXml(ProcessDocument document) {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try {
            Bpmn.writeModelToStream(outputStream, document.getModel());
        } catch (ModelException e) {
            throw new InvalidDocumentException("Transformed document failed validation: " + e.getMessage(), e);
        }
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    /** Serializes first, so a failing model never truncates {@code output}. */
    public void write(ProcessDocument document, Path output) {
        String xml = toXml(document);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + output, e);
        }
        log.info("Wrote {} ({} chars)", output, xml.length());
    }
}
