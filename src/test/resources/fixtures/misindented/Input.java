package fixtures;

import java.util.List;

public class Sample {
    private final List<String> names;

    public Sample(List<String> names) {
        this.names = names;
    }

    public int count(String prefix) {
      int total = 0;
        for (String name : names) {
              if (name.startsWith(prefix)) {
                total++;
            }
        }
        try {
            validate(total);
          } catch (IllegalStateException e) {
            return -1;
        }
        return total;
    }

    private void validate(int total) {
        if (total < 0) {
            throw new IllegalStateException("negative");
        }
    }
}
