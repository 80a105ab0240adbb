package com.flamingo.ai.voicecompanion.service.conversation;

import com.flamingo.ai.voicecompanion.service.retrieval.InjectedContext;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Builds the message list for one generation turn: optional side-context, then the user text. */
@Component
public class GenerationContextAssembler {

  public List<ChatMessage> assemble(InjectedContext context, String userText) {
    List<ChatMessage> messages = new ArrayList<>(2);
    if (context != null && !context.block().isBlank()) {
      messages.add(SystemMessage.from(context.block()));
    }
    messages.add(UserMessage.from(userText));
    return messages;
  }
}
