package fixtures;

import java.util.List;

public class Showcase {
    private static final int[] PRIMES = {
        2,
        3,
        5
    };

    private final Runnable task = new Runnable() {
        @Override
        public void run() {
            System.out.println("run");
        }
    };

    public int describe(int kind, List<String> items) {
        items.forEach(item -> {
            System.out.println(item);
        });
        if (kind > 0
                && kind < 10) {
            return kind;
        }
        switch (kind) {
            case 1:
                return 1;
            default:
                break;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            return -1;
        } finally {
            System.out.println("done");
        }
        return 0;
    }
}
