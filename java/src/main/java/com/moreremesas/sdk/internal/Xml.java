package com.moreremesas.sdk.internal;

import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Namespace-aware DOM parsing with DTDs and external entities disabled.
 */
public final class Xml {

    private static final DocumentBuilderFactory FACTORY = newFactory();

    private Xml() {
    }

    public static Document parse(byte[] body) throws IOException, SAXException {
        DocumentBuilder builder;
        try {
            synchronized (FACTORY) {
                builder = FACTORY.newDocumentBuilder();
            }
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("configure XML parser: " + ex.getMessage(), ex);
        }
        builder.setErrorHandler(RethrowingErrorHandler.INSTANCE);
        return builder.parse(new ByteArrayInputStream(body));
    }

    private static final class RethrowingErrorHandler implements ErrorHandler {
        private static final RethrowingErrorHandler INSTANCE = new RethrowingErrorHandler();

        @Override
        public void warning(SAXParseException exception) {
            // recoverable; the parser continues
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }

    private static DocumentBuilderFactory newFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("configure XML parser: " + ex.getMessage(), ex);
        }
        return factory;
    }
}
