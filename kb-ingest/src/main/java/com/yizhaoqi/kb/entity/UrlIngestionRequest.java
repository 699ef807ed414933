package com.yizhaoqi.kb.entity;

import com.yizhaoqi.kb.exception.ValidationException;
import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * A web page fetched at processing time. URL documents are always treated as html.
 */
public class UrlIngestionRequest extends IngestionRequest {

    private final String url;

    public UrlIngestionRequest(String url, String name) {
        super(name);
        this.url = url;
    }

    @Override
    public DocumentSourceType getSourceType() {
        return DocumentSourceType.URL;
    }

    @Override
    public String getLocator() {
        return url;
    }

    @Override
    public DocumentFileType getFileType() {
        return DocumentFileType.HTML;
    }

    @Override
    public String defaultName() {
        return parse().getHost();
    }

    @Override
    public void validate() {
        if (url == null || url.trim().isEmpty()) {
            throw new ValidationException("URL is required");
        }
        parse();
    }

    private URI parse() {
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new ValidationException("URL must be an absolute http(s) address: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ValidationException("Malformed URL: " + url);
        }
    }
}
