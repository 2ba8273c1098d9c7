package com.gentoro.usml.validator.rules;

import com.gentoro.usml.ast.ArrayMapping;
import com.gentoro.usml.ast.MappingNode;
import com.gentoro.usml.ast.Transform;
import com.gentoro.usml.validator.Diagnostic;
import com.gentoro.usml.validator.MappingSite;
import com.gentoro.usml.validator.ValidationCheck;
import com.gentoro.usml.validator.ValidationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transform targets must name a mapped field. A dotted target such as {@code comments.author}
 * walks array fields from the top level; a bare name matches a top-level field or a field of any
 * nested array.
 */
public final class TransformTargetExistsCheck implements ValidationCheck {
  public static final String RULE = "transform-target-exists";

  @Override
  public String rule() {
    return RULE;
  }

  @Override
  public List<Diagnostic> check(ValidationContext context) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<Transform> transforms = context.document().transforms();
    for (int i = 0; i < transforms.size(); i++) {
      String target = transforms.get(i).target();
      if (!targetExists(context, target)) {
        diagnostics.add(
            error(
                "Transform target '" + target + "' does not match any response_mapping field",
                "transforms[" + i + "].target"));
      }
    }
    return diagnostics;
  }

  static boolean targetExists(ValidationContext context, String target) {
    if (target.contains(".")) {
      return resolvePath(context.document().responseMappings(), target.split("\\.")).isPresent();
    }
    for (MappingSite site : context.scopes().sites()) {
      if (site.node().field().equals(target)) {
        return true;
      }
    }
    return false;
  }

  private static Optional<MappingNode> resolvePath(List<MappingNode> level, String[] segments) {
    List<MappingNode> current = level;
    MappingNode found = null;
    for (int i = 0; i < segments.length; i++) {
      found = null;
      for (MappingNode node : current) {
        if (node.field().equals(segments[i])) {
          found = node;
          break;
        }
      }
      if (found == null) {
        return Optional.empty();
      }
      if (i < segments.length - 1) {
        if (!(found instanceof ArrayMapping array)) {
          return Optional.empty();
        }
        current = array.children();
      }
    }
    return Optional.ofNullable(found);
  }
}
