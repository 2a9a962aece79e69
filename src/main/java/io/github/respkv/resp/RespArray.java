package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    final static char                    firstChar = '*';
    private final ImmutableList<RespData> datas;

    public static RespArray empty() {
        return new RespArray(ImmutableList.of());
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(ImmutableList.copyOf(datas));
    }

    public static RespArray with(RespData... datas) {
        return new RespArray(ImmutableList.copyOf(datas));
    }

    private RespArray(ImmutableList<RespData> datas) {
        for (RespData data : datas) {
            Preconditions.checkArgument(!(data instanceof RespNone), "resp array不能包含none");
        }
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public boolean isEmpty() {
        return datas.isEmpty();
    }

    public RespData get(int i) {
        return datas.get(i);
    }

    @Override
    public String textualForm() {
        return datas.stream().map(RespData::textualForm).collect(Collectors.joining(" "));
    }

    @Override
    public List<String> flatten() {
        List<String> out = new ArrayList<>();
        for (RespData data : datas) {
            if (data instanceof RespArray) {
                out.addAll(data.flatten());
            } else {
                out.add(data.textualForm());
            }
        }
        return out;
    }

    @Override
    public byte[] toBytes() {
        StringBuilder sb = new StringBuilder();
        sb.append(firstChar);
        sb.append(datas.size());
        sb.append("\r\n");

        byte[] bytes = sb.toString().getBytes(StandardCharsets.US_ASCII);

        for (RespData data : datas) {
            bytes = Bytes.concat(bytes, data.toBytes());
        }

        return bytes;
    }
}
