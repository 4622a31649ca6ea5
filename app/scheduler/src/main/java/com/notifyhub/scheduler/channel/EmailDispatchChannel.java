package com.notifyhub.scheduler.channel;

import com.notifyhub.scheduler.config.MailChannelProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP channel backed by {@link JavaMailSender}. Active when {@code spring.mail.host} is set. The
 * configured timeouts are applied to the SMTP transport so a single send is bounded.
 */
@Component
@ConditionalOnExpression("!'${spring.mail.host:}'.isBlank()")
public class EmailDispatchChannel implements DispatchChannel {

  public static final String CHANNEL_NAME = "email";

  private static final Logger logger = LoggerFactory.getLogger(EmailDispatchChannel.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JavaMailSender is a shared Spring-managed component")
  private final JavaMailSender mailSender;

  private final MailChannelProperties properties;

  public EmailDispatchChannel(JavaMailSender mailSender, MailChannelProperties properties) {
    this.mailSender = mailSender;
    this.properties = properties;
    applyTimeouts();
  }

  @Override
  public String channelName() {
    return CHANNEL_NAME;
  }

  @Override
  public DispatchResult send(OutboundMessage message) {
    try {
      final MimeMessage mimeMessage = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(mimeMessage, true, StandardCharsets.UTF_8.name());
      helper.setFrom(properties.fromAddress(), properties.fromName());
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      helper.setText(message.body(), message.body());
      mailSender.send(mimeMessage);
      final String messageId = mimeMessage.getMessageID();
      logger.debug("email sent to={} messageId={}", message.to(), messageId);
      return DispatchResult.delivered(messageId);
    } catch (MailException | MessagingException | UnsupportedEncodingException ex) {
      logger.warn("email send failed to={} error={}", message.to(), ex.getMessage());
      return DispatchResult.failed(ex.getMessage());
    }
  }

  @Override
  public void verifyReady() {
    if (!(mailSender instanceof JavaMailSenderImpl impl)) {
      return;
    }
    try {
      impl.testConnection();
    } catch (MessagingException ex) {
      throw new IllegalStateException("smtp server not reachable host=" + impl.getHost(), ex);
    }
  }

  private void applyTimeouts() {
    if (!(mailSender instanceof JavaMailSenderImpl impl)) {
      return;
    }
    final Properties mailProperties = impl.getJavaMailProperties();
    mailProperties.put(
        "mail.smtp.connectiontimeout", String.valueOf(properties.connectTimeout().toMillis()));
    mailProperties.put("mail.smtp.timeout", String.valueOf(properties.readTimeout().toMillis()));
    mailProperties.put(
        "mail.smtp.writetimeout", String.valueOf(properties.writeTimeout().toMillis()));
  }
}
