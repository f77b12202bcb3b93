package com.gateway.generator.codegen.render;

import java.io.IOException;
import java.io.StringWriter;

import com.gateway.generator.codegen.exception.GenerationException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders gateway files from the {@code gateway.go.ftl} class path template.
 */
public class FreemarkerTemplateRenderer implements TemplateRenderer {

    public static final String DEFAULT_TEMPLATE = "gateway.go.ftl";

    private final Configuration freemarkerConfig;
    private final String templateName;

    public FreemarkerTemplateRenderer() {
        this(DEFAULT_TEMPLATE);
    }

    public FreemarkerTemplateRenderer(String templateName) {
        this.freemarkerConfig = createFreemarkerConfig();
        this.templateName = templateName;
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    @Override
    public String render(RenderRequest request) {
        String fileName = request.getFile().getName();
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(request, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new GenerationException(GenerationException.Reason.RENDERING_FAILED, fileName,
                    "failed to render " + templateName + ": " + e.getMessage(), e);
        }
    }
}
