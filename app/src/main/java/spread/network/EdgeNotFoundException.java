package spread.network;

import java.util.NoSuchElementException;

/**
 * 存在しない辺 (u, v) を更新・削除・参照しようとした場合に送出される。
 */
public class EdgeNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final int u;
    private final int v;

    public EdgeNotFoundException(int u, int v) {
        super("Edge (" + u + ", " + v + ") does not exist");
        this.u = u;
        this.v = v;
    }

    public int getSource() {
        return u;
    }

    public int getTarget() {
        return v;
    }
}
