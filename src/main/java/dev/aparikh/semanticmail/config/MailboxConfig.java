package dev.aparikh.semanticmail.config;

import dev.aparikh.semanticmail.attachment.AttachmentExtractor;
import dev.aparikh.semanticmail.attachment.DocxDocumentParser;
import dev.aparikh.semanticmail.attachment.HtmlAttachmentParser;
import dev.aparikh.semanticmail.attachment.PdfDocumentParser;
import dev.aparikh.semanticmail.attachment.PlainTextParser;
import dev.aparikh.semanticmail.mailbox.GmailMailboxSource;
import dev.aparikh.semanticmail.mailbox.MailboxSource;
import dev.aparikh.semanticmail.text.HtmlTextExtractor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import java.util.List;

@Configuration
@EnableConfigurationProperties({GmailProperties.class, AttachmentProperties.class})
class MailboxConfig {

    @Bean
    AttachmentExtractor attachmentExtractor(HtmlTextExtractor html, AttachmentProperties attachment) {
        return new AttachmentExtractor(List.of(
                new PdfDocumentParser(),
                new DocxDocumentParser(),
                new HtmlAttachmentParser(html),
                new PlainTextParser()),
                attachment.getMaxSize().toBytes());
    }

    @Bean
    MailboxSource mailboxSource(RestClient.Builder builder, GmailProperties gmail, SyncProperties sync,
                                AttachmentExtractor attachmentExtractor) {
        RestClient restClient = builder.clone()
                .baseUrl(gmail.getBaseUrl())
                .build();
        return new GmailMailboxSource(restClient, sync.getPageSize(), attachmentExtractor);
    }
}
