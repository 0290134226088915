package dev.pekelund.billsplit.messaging;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "billsplit.messaging")
public class SplitMessagingProperties {

    /**
     * Entry in an item's assigned_to list marking it as shared by every participant.
     */
    private String everyoneLabel = "All";

    public String getEveryoneLabel() {
        return everyoneLabel;
    }

    public void setEveryoneLabel(String everyoneLabel) {
        this.everyoneLabel = everyoneLabel;
    }
}
