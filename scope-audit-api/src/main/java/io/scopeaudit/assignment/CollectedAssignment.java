// (Copyright) [2026 - 2026] Confluent, Inc.

package io.scopeaudit.assignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An assignment normalized into the canonical field set, but not yet classified. Temporal
 * values are kept as reported so that classification can decide how to treat values that do
 * not parse.
 */
public class CollectedAssignment {

  private final AssignmentCategory category;
  private final String name;
  private final String principalId;
  private final String principalDisplayName;
  private final String principalType;
  private final String definitionId;
  private final String definitionDisplayName;
  private final String scopePath;
  private final String startTime;
  private final String endTime;
  private final String createdOn;
  private final String condition;
  private final String conditionVersion;
  private final String enforcementMode;
  private final List<String> notScopes;

  private CollectedAssignment(Builder builder) {
    this.category = Objects.requireNonNull(builder.category, "category");
    this.name = builder.name;
    this.principalId = builder.principalId;
    this.principalDisplayName = builder.principalDisplayName;
    this.principalType = builder.principalType;
    this.definitionId = builder.definitionId;
    this.definitionDisplayName = builder.definitionDisplayName;
    this.scopePath = builder.scopePath;
    this.startTime = builder.startTime;
    this.endTime = builder.endTime;
    this.createdOn = builder.createdOn;
    this.condition = builder.condition;
    this.conditionVersion = builder.conditionVersion;
    this.enforcementMode = builder.enforcementMode;
    this.notScopes = Collections.unmodifiableList(new ArrayList<>(builder.notScopes));
  }

  public static Builder builder(AssignmentCategory category) {
    return new Builder(category);
  }

  public AssignmentCategory category() {
    return category;
  }

  public String name() {
    return name;
  }

  public String principalId() {
    return principalId;
  }

  public String principalDisplayName() {
    return principalDisplayName;
  }

  public String principalType() {
    return principalType;
  }

  public String definitionId() {
    return definitionId;
  }

  public String definitionDisplayName() {
    return definitionDisplayName;
  }

  public String scopePath() {
    return scopePath;
  }

  public String startTime() {
    return startTime;
  }

  public String endTime() {
    return endTime;
  }

  public String createdOn() {
    return createdOn;
  }

  public String condition() {
    return condition;
  }

  public String conditionVersion() {
    return conditionVersion;
  }

  public String enforcementMode() {
    return enforcementMode;
  }

  public List<String> notScopes() {
    return notScopes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CollectedAssignment)) {
      return false;
    }

    CollectedAssignment that = (CollectedAssignment) o;
    return category == that.category &&
        Objects.equals(name, that.name) &&
        Objects.equals(principalId, that.principalId) &&
        Objects.equals(principalDisplayName, that.principalDisplayName) &&
        Objects.equals(principalType, that.principalType) &&
        Objects.equals(definitionId, that.definitionId) &&
        Objects.equals(definitionDisplayName, that.definitionDisplayName) &&
        Objects.equals(scopePath, that.scopePath) &&
        Objects.equals(startTime, that.startTime) &&
        Objects.equals(endTime, that.endTime) &&
        Objects.equals(createdOn, that.createdOn) &&
        Objects.equals(condition, that.condition) &&
        Objects.equals(conditionVersion, that.conditionVersion) &&
        Objects.equals(enforcementMode, that.enforcementMode) &&
        Objects.equals(notScopes, that.notScopes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(category, name, principalId, principalDisplayName, principalType,
        definitionId, definitionDisplayName, scopePath, startTime, endTime, createdOn,
        condition, conditionVersion, enforcementMode, notScopes);
  }

  @Override
  public String toString() {
    return "CollectedAssignment(" +
        "category=" + category +
        ", name='" + name + '\'' +
        ", principalId='" + principalId + '\'' +
        ", definition='" + definitionDisplayName + '\'' +
        ", scopePath='" + scopePath + '\'' +
        ')';
  }

  public static class Builder {
    private final AssignmentCategory category;
    private String name;
    private String principalId;
    private String principalDisplayName;
    private String principalType;
    private String definitionId;
    private String definitionDisplayName;
    private String scopePath;
    private String startTime;
    private String endTime;
    private String createdOn;
    private String condition;
    private String conditionVersion;
    private String enforcementMode;
    private List<String> notScopes = Collections.emptyList();

    private Builder(AssignmentCategory category) {
      this.category = category;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder principal(String id, String displayName, String type) {
      this.principalId = id;
      this.principalDisplayName = displayName;
      this.principalType = type;
      return this;
    }

    public Builder definition(String id, String displayName) {
      this.definitionId = id;
      this.definitionDisplayName = displayName;
      return this;
    }

    public Builder scopePath(String scopePath) {
      this.scopePath = scopePath;
      return this;
    }

    public Builder schedule(String startTime, String endTime, String createdOn) {
      this.startTime = startTime;
      this.endTime = endTime;
      this.createdOn = createdOn;
      return this;
    }

    public Builder condition(String condition, String conditionVersion) {
      this.condition = condition;
      this.conditionVersion = conditionVersion;
      return this;
    }

    public Builder enforcementMode(String enforcementMode) {
      this.enforcementMode = enforcementMode;
      return this;
    }

    public Builder notScopes(List<String> notScopes) {
      this.notScopes = notScopes == null ? Collections.emptyList() : notScopes;
      return this;
    }

    public CollectedAssignment build() {
      return new CollectedAssignment(this);
    }
  }
}
