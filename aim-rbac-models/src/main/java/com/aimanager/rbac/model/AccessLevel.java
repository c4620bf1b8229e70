package com.aimanager.rbac.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Locale;

@RegisterForReflection
public enum AccessLevel {
   NONE(0, "None"),
   READ(1, "Read"),
   WRITE(2, "Write"),
   ADMIN(3, "Admin");

   private final int rank;
   private final String label;

   AccessLevel(int rank, String label) {
      this.rank = rank;
      this.label = label;
   }

   public int getRank() {
      return rank;
   }

   /**
    * Human readable form used in decision reasons, e.g. {@code Read}.
    */
   public String getLabel() {
      return label;
   }

   /**
    * @return true when this level is at least {@code required}
    */
   public boolean allows(AccessLevel required) {
      return required != null && rank >= required.rank;
   }

   @JsonValue
   public String toValue() {
      return name().toLowerCase(Locale.ROOT);
   }

   @JsonCreator
   public static AccessLevel fromString(String value) {
      if (value == null) {
         return null;
      }
      return AccessLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
   }
}
