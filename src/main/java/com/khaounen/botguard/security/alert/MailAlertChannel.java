package com.khaounen.botguard.security.alert;

import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.List;
import java.util.Locale;

public class MailAlertChannel implements AlertChannel {

    private final JavaMailSender sender;
    private final String from;
    private final List<String> to;
    private final String subjectPrefix;

    public MailAlertChannel(JavaMailSender sender, String from, List<String> to, String subjectPrefix) {
        this.sender = sender;
        this.from = from;
        this.to = List.copyOf(to);
        this.subjectPrefix = subjectPrefix == null ? "" : subjectPrefix;
    }

    @Override
    public String name() {
        return "mail";
    }

    @Override
    public void publish(GuardAlert alert) {
        sender.send(message(alert));
    }

    SimpleMailMessage message(GuardAlert alert) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to.toArray(new String[0]));
        String client = alert.clientIp() == null ? "unknown client" : alert.clientIp();
        String subject = subjectPrefix
                + " " + alert.action().name().toLowerCase(Locale.ROOT)
                + " " + alert.reason().name().toLowerCase(Locale.ROOT)
                + " from " + client;
        message.setSubject(subject.trim());
        message.setText(alert.text());
        return message;
    }
}
