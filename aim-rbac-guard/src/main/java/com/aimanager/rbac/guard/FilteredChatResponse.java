package com.aimanager.rbac.guard;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Value;

import java.util.List;

@RegisterForReflection
@Value
public class FilteredChatResponse {
   String text;
   List<ChatSource> sources;
   // true when the text or any source differs from the input
   boolean filtered;
}
