package info.isaksson.erland.seqtoeventb.advisor;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface PropertyAssistant {

    @SystemMessage("""
            You are an Event-B and model-checking assistant.
            Given the participants and ordered message instances of a sequence diagram that was
            compiled into an Event-B machine, propose LTL properties worth checking with ProB.

            The machine has these variables:
            - sentMessages, receivedMessages, currentMessage (subsets of Messages)
            - sender, receiver (relations Messages <-> Objects)
            - senderdataMessages, receiverdataMessages (relations Messages <-> DataMessages)

            Rules:
            - Use ProB LTL syntax with Event-B ASCII predicates in braces, e.g. G({x : sentMessages} => F{x : receivedMessages}).
            - Only refer to the given message and participant identifiers.
            - Give 3 to 8 properties, one per line, each followed by a short comment starting with //.
            """)
    @UserMessage("""
            Model: {{baseName}}
            Participants: {{participants}}
            Messages in order: {{messages}}
            """)
    String propose(@V("baseName") String baseName,
                   @V("participants") String participants,
                   @V("messages") String messages);
}
