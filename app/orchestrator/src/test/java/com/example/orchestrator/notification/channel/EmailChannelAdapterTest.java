package com.example.orchestrator.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationPayload;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

@ExtendWith(MockitoExtension.class)
class EmailChannelAdapterTest {

  private static final EndpointConfig CONFIG =
      new EndpointConfig(
          Map.of(
              "senderAddress", "portal@example.com",
              "smtpHost", "smtp.example.com",
              "recipient", "admin@example.com"));
  private static final NotificationPayload PAYLOAD =
      NotificationPayload.of(NotificationEventType.JOB_FAILED, "Job Failed: <scan>", "boom")
          .withField("Job", "library-scan");

  @Mock private MailSenderFactory mailSenderFactory;
  @Mock private JavaMailSender mailSender;

  private EmailChannelAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter = new EmailChannelAdapter(mailSenderFactory, HttpFixture.PROPERTIES);
  }

  private void stubSender() {
    when(mailSenderFactory.create(CONFIG)).thenReturn(mailSender);
    when(mailSender.createMimeMessage())
        .thenReturn(new MimeMessage(Session.getInstance(new Properties())));
  }

  @Test
  void sendBuildsMultipartMessage() throws Exception {
    stubSender();
    final DeliveryResult result = adapter.send(CONFIG, PAYLOAD);

    assertThat(result.ok()).isTrue();
    final ArgumentCaptor<MimeMessage> message = ArgumentCaptor.forClass(MimeMessage.class);
    verify(mailSender).send(message.capture());
    assertThat(message.getValue().getSubject()).isEqualTo("[Media Portal] Job Failed: <scan>");
    final InternetAddress from = (InternetAddress) message.getValue().getFrom()[0];
    assertThat(from.getAddress()).isEqualTo("portal@example.com");
    assertThat(from.getPersonal()).isEqualTo("Media Portal");
    assertThat(message.getValue().getAllRecipients()[0].toString()).isEqualTo("admin@example.com");
  }

  @Test
  void htmlBodyEscapesContent() {
    assertThat(adapter.htmlBody(PAYLOAD))
        .contains("<h2>Job Failed: &lt;scan&gt;</h2>")
        .contains("<li><b>Job:</b> library-scan</li>");
  }

  @Test
  void authenticationFailureIsNetworkError() {
    stubSender();
    doThrow(new MailAuthenticationException("535 bad credentials"))
        .when(mailSender)
        .send(any(MimeMessage.class));

    final DeliveryResult result = adapter.send(CONFIG, PAYLOAD);

    assertThat(result.error().kind()).isEqualTo(DeliveryError.Kind.NETWORK);
  }

  @Test
  void socketTimeoutIsTimeout() {
    stubSender();
    doThrow(new MailSendException("send failed", new SocketTimeoutException("Read timed out")))
        .when(mailSender)
        .send(any(MimeMessage.class));

    final DeliveryResult result = adapter.send(CONFIG, PAYLOAD);

    assertThat(result.error().kind()).isEqualTo(DeliveryError.Kind.TIMEOUT);
  }

  @Test
  void factoryAppliesEncryptionDefaultsAndTimeouts() {
    final MailSenderFactory factory = new MailSenderFactory(HttpFixture.PROPERTIES);

    final JavaMailSenderImpl sender =
        (JavaMailSenderImpl)
            factory.create(
                new EndpointConfig(
                    Map.of(
                        "smtpHost", "smtp.example.com",
                        "encryption", "starttls",
                        "authUser", "bot",
                        "authPass", "secret")));

    assertThat(sender.getHost()).isEqualTo("smtp.example.com");
    assertThat(sender.getPort()).isEqualTo(587);
    assertThat(sender.getUsername()).isEqualTo("bot");
    assertThat(sender.getJavaMailProperties())
        .containsEntry("mail.smtp.auth", "true")
        .containsEntry("mail.smtp.starttls.enable", "true")
        .containsEntry("mail.smtp.timeout", "15000");
  }
}
